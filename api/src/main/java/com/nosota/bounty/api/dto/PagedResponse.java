package com.nosota.bounty.api.dto;

import java.util.List;

/**
 * One page of a longer listing.
 *
 * @param data         Records of the current page, at most {@code pageSize} of them
 * @param pageNumber   Zero-based page index
 * @param pageSize     Requested page size
 * @param totalRecords Number of records across all pages
 * @param totalPages   Number of pages for {@code pageSize}
 * @param <T>          Record type
 */
public record PagedResponse<T>(
        List<T> data,
        int pageNumber,
        int pageSize,
        long totalRecords,
        int totalPages
) {
    /**
     * Builds a page, deriving {@code totalPages} from the record count.
     *
     * @throws IllegalArgumentException if {@code pageSize} is not positive
     */
    public static <T> PagedResponse<T> of(List<T> data, int pageNumber, int pageSize, long totalRecords) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        int totalPages = (int) Math.ceil((double) totalRecords / pageSize);
        return new PagedResponse<>(data, pageNumber, pageSize, totalRecords, totalPages);
    }
}
