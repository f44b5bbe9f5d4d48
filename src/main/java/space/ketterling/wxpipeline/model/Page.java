package space.ketterling.wxpipeline.model;

import java.util.List;

/**
 * One page of a listing plus the totals needed for the pagination envelope.
 */
public record Page<T>(List<T> data, int page, int perPage, long total) {

    public int pages() {
        if (perPage <= 0)
            return 0;
        return (int) ((total + perPage - 1) / perPage);
    }

    public boolean hasNext() {
        return page < pages();
    }

    public boolean hasPrev() {
        return page > 1;
    }
}
