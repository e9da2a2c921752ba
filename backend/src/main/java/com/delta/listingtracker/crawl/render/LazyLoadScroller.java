package com.delta.listingtracker.crawl.render;

import java.util.function.IntSupplier;

/**
 * Scrolls to the bottom until the document height stops growing or the pass budget is spent, so
 * lazily rendered cards are in the DOM before extraction.
 */
final class LazyLoadScroller {
    private final IntSupplier documentHeight;
    private final Runnable scrollToBottom;
    private final Runnable pause;

    LazyLoadScroller(IntSupplier documentHeight, Runnable scrollToBottom, Runnable pause) {
        this.documentHeight = documentHeight;
        this.scrollToBottom = scrollToBottom;
        this.pause = pause;
    }

    /**
     * @return number of scroll passes performed
     */
    int scroll(int maxPasses) {
        int lastHeight = -1;
        int passes = 0;
        while (passes < maxPasses) {
            int height = documentHeight.getAsInt();
            if (height == lastHeight) {
                break;
            }
            scrollToBottom.run();
            pause.run();
            lastHeight = height;
            passes++;
        }
        return passes;
    }
}
