package com.example.reviewharvester.scraper;

/**
 * What the scroll loop needs from a page: a way to ask for more content and a way
 * to read how much has loaded so far.
 */
public interface ScrollablePage {

    /** Issue one scroll / load-more action covering {@code pageHeights} viewport heights. */
    void advance(int pageHeights) throws HarvestException;

    /** Number of review units loaded so far. */
    int loadedCount() throws HarvestException;
}
