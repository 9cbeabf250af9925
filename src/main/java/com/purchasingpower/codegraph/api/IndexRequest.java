package com.purchasingpower.codegraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Index repository request. {@code repoId} defaults to the last segment of the URL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexRequest {

    private String repoUrl;
    private String repoId;
}
