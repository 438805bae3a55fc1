package com.axlabs.neo.multisig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Utility for paging through stored entries.
 */
public class Paginator {

    /**
     * Calculates the start and end indices of a page in the list of {@code n} items.
     *
     * @param n            The total number of available items.
     * @param page         The desired page.
     * @param itemsPerPage The desired number of items per page.
     * @return The start and end index of items on the desired page, plus the total number of pages available given
     * that there are {@code n} items.
     */
    static int[] calcPagination(int n, int page, int itemsPerPage) {
        int pages;
        if (n < itemsPerPage) {
            pages = 1;
        } else if (n % itemsPerPage == 0) {
            pages = n / itemsPerPage;
        } else {
            pages = (n / itemsPerPage) + 1;
        }
        if (page >= pages) throw new ValidationException("Paginator.calcPagination", "Page out of bounds");
        int startAt = itemsPerPage * page;
        int endAt = startAt + itemsPerPage;
        if (startAt + itemsPerPage > n) {
            endAt = n;
        }
        return new int[]{startAt, endAt, pages};
    }

    /**
     * Cuts the requested page out of {@code items}.
     *
     * @param items        All items.
     * @param page         The desired page, starting at 0.
     * @param itemsPerPage The desired number of items per page.
     * @param method       The operation asking for the page, used in error messages.
     * @param <T>          The item type.
     * @return the page.
     */
    public static <T> Paginated<T> paginate(List<T> items, int page, int itemsPerPage, String method) {
        if (page < 0) throw new ValidationException(method, "Page number was negative");
        if (itemsPerPage <= 0) throw new ValidationException(method, "Items per page was negative or zero");
        int[] pagination = calcPagination(items.size(), page, itemsPerPage);
        return new Paginated<>(page, pagination[2], new ArrayList<>(items.subList(pagination[0], pagination[1])));
    }

    /**
     * Used to return a page in a set of items.
     * <p>
     * Instead of just returning the items of a page, this gives some context information, i.e., the page number and
     * the total number of pages available.
     */
    public static class Paginated<T> {
        public final int page;
        public final int pages;
        public final List<T> items;

        public Paginated(int page, int pages, List<T> items) {
            this.page = page;
            this.pages = pages;
            this.items = Collections.unmodifiableList(items);
        }
    }
}
