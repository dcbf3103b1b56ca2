package org.janelia.mediasync.model.page;

import org.apache.commons.lang3.builder.ToStringBuilder;

public class PageRequest {
    private long pageNumber;
    private int pageSize;

    public PageRequest() {
    }

    public PageRequest(long pageNumber, int pageSize) {
        this.pageNumber = pageNumber;
        this.pageSize = pageSize;
    }

    public long getPageNumber() {
        return pageNumber;
    }

    public void setPageNumber(long pageNumber) {
        this.pageNumber = pageNumber;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public long getOffset() {
        if (pageNumber > 0 && pageSize > 0) {
            return pageNumber * pageSize;
        }
        return 0L;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("pageNumber", pageNumber)
                .append("pageSize", pageSize)
                .toString();
    }
}
