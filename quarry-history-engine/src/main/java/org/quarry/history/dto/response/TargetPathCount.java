package org.quarry.history.dto.response;

public record TargetPathCount(String path, long count) {
}
