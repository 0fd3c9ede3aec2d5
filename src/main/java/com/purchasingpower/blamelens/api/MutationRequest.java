package com.purchasingpower.blamelens.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a repository mutation signal, e.g. sent by a post-checkout or post-merge hook.
 * Both fields are optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MutationRequest {

    private String repository;
    private String reason;
}
