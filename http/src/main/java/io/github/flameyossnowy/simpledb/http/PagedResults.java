package io.github.flameyossnowy.simpledb.http;

import io.github.flameyossnowy.simpledb.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Results of a paged action, fetched lazily.
 *
 * <p>Each call to {@link #iterator()} starts over from the first page. A page
 * is requested only when the previous one is used up, and iteration ends
 * after the first page that carries no next token.</p>
 *
 * @param <T> the type of element on each page
 */
public final class PagedResults<T> implements Iterable<T> {
    private final Function<String, Page<T>> fetcher;

    /**
     * @param fetcher requests a page; receives {@code null} for the first
     *                page and the previous page's token after that
     */
    public PagedResults(@NotNull Function<String, Page<T>> fetcher) {
        this.fetcher = fetcher;
    }

    @Override
    public @NotNull Iterator<T> iterator() {
        return new PageIterator<>(fetcher);
    }

    /**
     * Fetches every page.
     */
    public List<T> toList() {
        List<T> list = new ArrayList<>();
        for (T element : this) {
            list.add(element);
        }
        return list;
    }

    private static final class PageIterator<T> implements Iterator<T> {
        private final Function<String, Page<T>> fetcher;
        private Iterator<T> current;
        private String nextToken;
        private int pages;
        private Boolean hasNext;

        PageIterator(Function<String, Page<T>> fetcher) {
            this.fetcher = fetcher;
        }

        @Override
        public boolean hasNext() {
            if (hasNext == null) {
                hasNext = advance();
            }
            return hasNext;
        }

        private boolean advance() {
            while (current == null || !current.hasNext()) {
                if (current != null && nextToken == null) {
                    return false;
                }
                Page<T> page = fetcher.apply(nextToken);
                pages++;
                int number = pages;
                Logging.deepInfo(() -> "Fetched page " + number + " with " + page.items().size() + " results");
                current = page.items().iterator();
                nextToken = page.nextToken();
            }
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more results");
            }
            hasNext = null;
            return current.next();
        }
    }
}
