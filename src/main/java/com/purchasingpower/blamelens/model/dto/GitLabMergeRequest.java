package com.purchasingpower.blamelens.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Merge request as returned by the GitLab v4 API.
 *
 * {@code changes_count} is only present on the single merge request endpoint.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitLabMergeRequest {

    private long id;

    private long iid;

    private String title;

    @JsonProperty("web_url")
    private String webUrl;

    private String state;

    @JsonProperty("merged_at")
    private String mergedAt;

    @JsonProperty("changes_count")
    private String changesCount;
}
