package com.d2stacks.core.repository;

import com.d2stacks.core.model.D2NewStack;
import com.d2stacks.core.model.D2Stack;
import com.d2stacks.core.model.D2StackStats;
import com.d2stacks.core.model.MaybeWarnings;
import com.d2stacks.core.result.Result;
import com.d2stacks.core.result.Unit;

import java.util.List;

/**
 * DHIS2 stacks of the current session's endpoint.
 */
public interface D2StacksRepository {

    Result<List<D2Stack>, String> get();

    Result<D2Stack, String> getById(int id);

    /**
     * Deletes in order and stops at the first failure; earlier ids may already be deleted.
     */
    Result<Unit, String> delete(List<Integer> ids);

    Result<Unit, String> start(D2Stack stack);

    Result<Unit, String> stop(D2Stack stack);

    /**
     * Creates the stack, then applies its permission. A permission failure leaves the
     * stack in place and is reported as a warning.
     */
    Result<MaybeWarnings<Unit>, String> create(D2NewStack newStack);

    Result<Unit, String> update(D2Stack stack);

    D2StackStats getStatsUrls(D2Stack stack);
}
