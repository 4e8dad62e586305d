package com.d2stacks.portainer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of a repository-method stack creation: the compose file is pulled from a git repository.
 */
public record PostStackRequest(
    @JsonProperty("Name") String name,
    @JsonProperty("RepositoryURL") String repositoryUrl,
    @JsonProperty("RepositoryReferenceName") String repositoryReferenceName,
    @JsonProperty("ComposeFilePathInRepository") String composeFilePathInRepository,
    @JsonProperty("RepositoryAuthentication") boolean repositoryAuthentication,
    @JsonProperty("Env") List<EnvVar> env
) {

    public PostStackRequest {
        env = env != null ? List.copyOf(env) : List.of();
    }
}
