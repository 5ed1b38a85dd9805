package com.z254.genesis.mnemos.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageMetadata {

    private int page;
    private int pageSize;
    private long totalCount;
    private int totalPages;
    private boolean hasNext;
    private boolean hasPrev;

    public static PageMetadata of(int page, int pageSize, long totalCount) {
        int totalPages = (int) ((totalCount + pageSize - 1) / pageSize);
        return PageMetadata.builder()
                .page(page)
                .pageSize(pageSize)
                .totalCount(totalCount)
                .totalPages(totalPages)
                .hasNext(page < totalPages)
                .hasPrev(page > 1)
                .build();
    }
}
