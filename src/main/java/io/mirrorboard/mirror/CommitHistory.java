package io.mirrorboard.mirror;

import io.mirrorboard.error.MirrorException;
import io.mirrorboard.error.ValidationException;

import java.util.List;

/**
 * Commit log of a mirror repository. Every mirror write lands as one commit on the mirror branch.
 */
public interface CommitHistory {
    int DEFAULT_PER_PAGE = 30;
    int MAX_PER_PAGE = 100;

    /**
     * Newest first, one page of the branch history.
     *
     * @param perPage 1 to {@value #MAX_PER_PAGE}
     * @param page    1-based
     */
    List<CommitInfo> commits(int perPage, int page) throws MirrorException;

    CommitInfo commit(String sha) throws MirrorException;

    static void checkPage(int perPage, int page) {
        if (perPage > MAX_PER_PAGE) {
            throw new ValidationException("per_page cannot exceed " + MAX_PER_PAGE + ", got " + perPage);
        }
        if (perPage < 1) {
            throw new ValidationException("per_page must be positive, got " + perPage);
        }
        if (page < 1) {
            throw new ValidationException("page must be positive, got " + page);
        }
    }
}
