/*
 * @LICENSE@
 */
package org.multisearch;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The matches of one search, produced lazily. A task on the searcher's
 * executor reads the input and puts matches into a small bounded buffer; it
 * blocks when the buffer is full, and {@link #hasNext()} blocks when it is
 * empty.
 * <p>
 * The sequence ends at end of input. A read failure also ends it; the
 * exception is kept and can be had from {@link #ioException()}. So does an
 * interrupt of the producing task, reported as an
 * {@link InterruptedIOException}. An unchecked exception thrown by the input
 * ends the sequence too, and is rethrown, wrapped, from {@link #hasNext()}.
 * <p>
 * A consumer may stop at any point. {@link #close()} stops the producer right
 * away; an instance which is simply dropped is noticed by the producer the
 * next time it waits on the buffer (the producer only holds it weakly).
 * Either way the input is not read any further. The input itself is never
 * closed here.
 * <p>
 * Instances are single use and, like the {@link java.util.Iterator}s they
 * are, not thread safe.
 */
public final class Matches extends Misc.ImmutableIterator<Match> implements
        Iterable<Match>, Closeable {

    private static final Logger logger = Logger.getLogger("org.multisearch");
    private static final Level level = Level.FINEST;

    /**
     * The match buffer capacity.
     * <p>
     * Not <code>private</code> or <code>final</code> in order to facilitate
     * testing.
     */
    static int BUFFER_CAPACITY = 2;

    /**
     * How long a blocked producer waits before checking whether its consumer
     * has gone away, and a waiting consumer before checking whether its
     * producer has.
     */
    static long OFFER_POLL_MILLIS = 100;

    private static final Object END = new Object();

    /*
     * What the producer and consumer share; everything but the consumer itself.
     */
    private static final class Feed {
        final BlockingQueue<Object> queue = new ArrayBlockingQueue<Object>(BUFFER_CAPACITY);
        volatile boolean closed = false;
        volatile boolean finished = false;   // set after the last put
        volatile IOException iox = null;
        volatile RuntimeException failure = null;
    }

    private static final class Producer implements Runnable {

        private final Feed feed;
        private final WeakReference<Matches> owner;
        private final SearchTrie trie;
        private final CodePointSource in;
        private final Map<String, Integer> lengths = new HashMap<String, Integer>();

        Producer(Feed feed, Matches owner, SearchTrie trie, CodePointSource in) {
            this.feed = feed;
            this.owner = new WeakReference<Matches>(owner);
            this.trie = trie;
            this.in = in;
        }

        public void run() {
            logger.log(level, "search started: " + in);
            Cursor cursor = trie.cursor();
            int count = 0;
            try {
                try {
                    int cp;
                    while ((cp = in.read()) != CodePointSource.EOF) {
                        if (abandoned()) {
                            logger.log(level, "search abandoned: " + cursor);
                            return;
                        }
                        for (String term : cursor.step(cp, in.width())) {
                            int end = cursor.offset();
                            if (!offer(new Match(term, end - lengthOf(term), end))) {
                                logger.log(level, "search abandoned: " + cursor);
                                return;
                            }
                            ++count;
                        }
                    }
                } catch (IOException e) {
                    feed.iox = e;
                    logger.log(Level.FINE, "read failure ends search", e);
                } catch (RuntimeException e) {
                    feed.failure = e;
                    logger.log(Level.FINE, "input failure ends search", e);
                }
                offer(END);
                logger.log(level, "search finished: " + cursor + " matches=" + count);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                InterruptedIOException iox = new InterruptedIOException("search interrupted: " + cursor);
                iox.bytesTransferred = cursor.offset();
                feed.iox = iox;
                logger.log(Level.FINE, "search interrupted: " + cursor);
            } finally {
                // no END if interrupted; the consumer sees this instead
                feed.finished = true;
            }
        }

        private int lengthOf(String term) {
            Integer n = lengths.get(term);
            if (n == null) {
                lengths.put(term, n = in.encodedLength(term));
            }
            return n;
        }

        private boolean abandoned() {
            return feed.closed || owner.get() == null;
        }

        private boolean offer(Object o) throws InterruptedException {
            while (!feed.queue.offer(o, OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (abandoned()) {
                    return false;
                }
            }
            return true;
        }
    }

    private final Feed feed = new Feed();
    private Match next = null;
    private boolean done = false;
    private boolean iterated = false;

    Matches(SearchTrie trie, CodePointSource in, Executor executor) {
        executor.execute(new Producer(feed, this, trie, in));
    }

    /**
     * Waits for the next match, or for the end of the sequence.
     *
     * @throws IllegalStateException
     *             once, at the end of a sequence cut short by an unchecked
     *             exception from the input; it is the cause.
     */
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (done) {
            return false;
        }
        Object o;
        try {
            o = take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            return false;
        }
        if (o == END) {
            done = true;
            RuntimeException failure = feed.failure;
            if (failure != null) {
                throw new IllegalStateException("search failed: " + failure, failure);
            }
            return false;
        }
        next = (Match) o;
        return true;
    }

    /*
     * The next item, or END once the producer is finished and everything it
     * put has been taken.
     */
    private Object take() throws InterruptedException {
        while (true) {
            Object o = feed.queue.poll(OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (o != null) {
                return o;
            }
            if (feed.finished) {
                o = feed.queue.poll();
                return o != null ? o : END;
            }
        }
    }

    public Match next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Match ret = next;
        next = null;
        return ret;
    }

    /**
     * This instance, as an {@link Iterable} for use in a for-each loop. Can
     * be called only once.
     *
     * @throws IllegalStateException
     *             on the second call.
     */
    public Iterator<Match> iterator() {
        if (iterated) {
            throw new IllegalStateException("matches can only be iterated once");
        }
        iterated = true;
        return this;
    }

    /**
     * @return the exception which ended the search early, or
     *         <code>null</code>. Only meaningful once {@link #hasNext()} has
     *         returned <code>false</code>.
     */
    public IOException ioException() {
        return feed.iox;
    }

    /**
     * Stops the search. Any buffered matches are dropped, and
     * {@link #hasNext()} returns <code>false</code> from here on.
     */
    public void close() {
        feed.closed = true;
        done = true;
        next = null;
        feed.queue.clear();
    }

    @Override
    public String toString() {
        return "Matches: buffered=" + feed.queue.size()
                + (done ? " (done)" : "") + (feed.closed ? " (closed)" : "");
    }
}
