package com.d2stacks.dispatch.cli;

import com.d2stacks.core.model.D2Stack;
import com.d2stacks.core.model.StackStatus;
import picocli.CommandLine;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the d2stacks CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) D2STACKS v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [D2STACKS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warning(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void stackHeader() {
        System.out.printf("  %-6s %-32s %-8s %-10s %-6s %s%n",
                "ID", "NAME", "STATUS", "ACCESS", "PORT", "DATA IMAGE");
        System.out.println("  " + "-".repeat(90));
    }

    public static void stackRow(D2Stack stack) {
        String status = stack.status() == StackStatus.RUNNING
                ? "@|fg(green) " + pad(stack.status().name(), 8) + "|@"
                : "@|fg(red) " + pad(stack.status().name(), 8) + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-6d %-32s ",
                stack.id(), truncate(stack.name(), 32)) + status + String.format(" %-10s %-6s %s",
                stack.access(), stack.port() > 0 ? String.valueOf(stack.port()) : "-", stack.dataImage())));
    }

    public static void stackDetail(D2Stack stack) {
        System.out.println();
        System.out.println("STACK " + stack.id() + " " + stack.name());
        System.out.println(RULE);
        System.out.println("  Status:      " + stack.status());
        System.out.println("  Data image:  " + orDash(stack.dataImage()));
        System.out.println("  Core image:  " + orDash(stack.coreImage()));
        System.out.println("  Port:        " + (stack.port() > 0 ? stack.port() : "-"));
        System.out.println("  Access:      " + stack.access());
        System.out.println("  Teams:       " + ids(stack.teamIds()));
        System.out.println("  Users:       " + ids(stack.userIds()));
        if (!stack.containerIds().isEmpty()) {
            System.out.println();
            System.out.println("  CONTAINERS:");
            stack.containerIds().forEach((role, id) ->
                    System.out.printf("    %-10s %s%n", role, truncate(id, 12)));
        }
    }

    static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static String pad(String s, int width) {
        return String.format("%-" + width + "s", s);
    }

    private static String orDash(String s) {
        return s == null || s.isEmpty() ? "-" : s;
    }

    private static String ids(List<Integer> ids) {
        return ids.isEmpty() ? "-" : ids.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
