package com.purchasingpower.blamelens.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitHubCommit {

    private String sha;

    private CommitDetails commit;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CommitDetails {
        private String message;
    }

    public String getMessageText() {
        if (commit == null || commit.getMessage() == null) return "";
        return commit.getMessage();
    }
}
