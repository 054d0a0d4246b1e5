package com.ictskills.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Objects;

/**
 * Outcome of a dashboard query: either a response or an error kind with a message.
 *
 * The dashboard path never throws; callers branch on {@link #isOk()}.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class DashboardResult {

    private final DashboardResponse response;
    private final ErrorKind errorKind;
    private final String errorMessage;

    public enum ErrorKind {
        INVALID_QUERY,
        DATA_SOURCE,
        COMPUTATION
    }

    public static DashboardResult ok(DashboardResponse response) {
        return new DashboardResult(Objects.requireNonNull(response, "response"), null, null);
    }

    public static DashboardResult failure(ErrorKind kind, String message) {
        return new DashboardResult(null, Objects.requireNonNull(kind, "kind"),
                message != null ? message : kind.name());
    }

    public boolean isOk() {
        return response != null;
    }
}
