package org.janelia.mediasync.model.page;

import java.util.ArrayList;
import java.util.List;

public class PageResult<T> {
    private final PageRequest pageRequest;
    private final List<T> resultList;
    private final long totalCount;

    public PageResult(PageRequest pageRequest, List<T> resultList, long totalCount) {
        this.pageRequest = pageRequest;
        this.resultList = resultList == null ? new ArrayList<>() : resultList;
        this.totalCount = totalCount;
    }

    public PageRequest getPageRequest() {
        return pageRequest;
    }

    public List<T> getResultList() {
        return resultList;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public boolean isEmpty() {
        return resultList.isEmpty();
    }
}
