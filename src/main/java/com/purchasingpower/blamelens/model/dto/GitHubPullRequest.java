package com.purchasingpower.blamelens.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Pull request as returned by the GitHub REST API.
 *
 * The size fields are only filled in by the single pull request endpoint.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitHubPullRequest {

    private long id;

    private long number;

    private String title;

    @JsonProperty("html_url")
    private String htmlUrl;

    private String state;

    @JsonProperty("merged_at")
    private String mergedAt;

    private Integer additions;

    private Integer deletions;

    @JsonProperty("changed_files")
    private Integer changedFiles;
}
