package net.revivatech.controller.dto;

import java.util.List;

/** Concrete paths that can be rendered ahead of time. */
public record StaticPathsResponse(List<String> paths, int count) {

    public static StaticPathsResponse of(List<String> paths) {
        return new StaticPathsResponse(paths, paths.size());
    }
}
