package com.example.docimport;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;

/**
 * A running decode: one reader thread feeding a bounded queue, {@code workers} conversion threads,
 * and a bounded output the caller drains with {@link #next()} or {@link #drainTo(Consumer)}.
 * <p>
 * The first read or conversion error is latched as the terminal error. From then on the reader
 * admits nothing more and workers drain the queue, converting only records that precede the
 * failing one. In ordered mode the output is therefore exactly the documents before the failing
 * record. {@link #close()} stops every thread whether or not the output was drained.
 */
@Slf4j
public class DocumentStream implements AutoCloseable {

    private static final Object END = new Object();

    private final DocumentConverter converter;
    private final RecordSource source;
    private final int workers;
    private final long pollMillis;

    private final BlockingQueue<RawRecord> input;
    private final BlockingQueue<Object> output;
    private final OrderedReassembler reassembler;
    private final ExecutorService executor;

    private final AtomicReference<ImportException> terminalError = new AtomicReference<>();
    private final AtomicInteger liveWorkers;
    private final LongAdder emitted = new LongAdder();
    private volatile long haltIndex = Long.MAX_VALUE;
    private volatile long admitted = 0;
    private volatile boolean producerDone = false;
    private volatile boolean cancelled = false;
    private boolean drained = false;

    DocumentStream(DocumentConverter converter, RecordSource source, EngineConfig cfg) {
        this.converter = converter;
        this.source = source;
        this.workers = cfg.getWorkers();
        this.pollMillis = cfg.getPollIntervalMillis();
        this.input = new ArrayBlockingQueue<>(workers);
        this.output = new ArrayBlockingQueue<>(workers);
        this.reassembler = cfg.isOrdered() ? new OrderedReassembler(2 * workers, this::emit) : null;
        this.liveWorkers = new AtomicInteger(workers);
        // the pool starts one thread per submit, in order: reader first, then the workers
        AtomicInteger threadNo = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workers + 1, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            int n = threadNo.getAndIncrement();
            t.setName(n == 0 ? "docimport-reader" : "docimport-worker-" + n);
            return t;
        });
    }

    void start() {
        log.debug("Starting decode: workers={}, ordered={}", workers, reassembler != null);
        executor.submit(this::produce);
        for (int i = 0; i < workers; i++) {
            executor.submit(this::work);
        }
    }

    /**
     * Next document, blocking until one is available. Returns null once the stream has ended,
     * after which {@link #terminalError()} is final.
     */
    public Document next() throws InterruptedException {
        while (!drained && !cancelled) {
            Object item = output.poll(pollMillis, TimeUnit.MILLISECONDS);
            if (item == END) {
                drained = true;
            } else if (item != null) {
                return (Document) item;
            }
        }
        return null;
    }

    /**
     * Hands every document to {@code consumer}, then throws the terminal error if there was one.
     *
     * @return number of documents delivered
     */
    public long drainTo(Consumer<Document> consumer) throws ImportException, InterruptedException {
        long delivered = 0;
        try {
            Document doc;
            while ((doc = next()) != null) {
                consumer.accept(doc);
                delivered++;
            }
        } catch (RuntimeException | InterruptedException e) {
            close();
            throw e;
        }
        ImportException error = terminalError.get();
        if (error != null) {
            throw error;
        }
        return delivered;
    }

    public Optional<ImportException> terminalError() {
        return Optional.ofNullable(terminalError.get());
    }

    public long documentsEmitted() {
        return emitted.sum();
    }

    public long recordsAdmitted() {
        return admitted;
    }

    @Override
    public void close() {
        if (!cancelled) {
            cancelled = true;
            executor.shutdownNow();
        }
    }

    private boolean halted() {
        return cancelled || terminalError.get() != null;
    }

    private void produce() {
        try {
            RawRecord record;
            while (!halted() && (record = source.next()) != null) {
                if (!admit(record)) {
                    break;
                }
                admitted++;
            }
        } catch (ReadException e) {
            fail(e, admitted);
        } catch (RuntimeException e) {
            fail(new ReadException(admitted + 1, e), admitted);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            producerDone = true;
        }
    }

    private boolean admit(RawRecord record) throws InterruptedException {
        if (reassembler != null) {
            while (!reassembler.permits().tryAcquire(pollMillis, TimeUnit.MILLISECONDS)) {
                if (halted()) {
                    return false;
                }
            }
        }
        while (!input.offer(record, pollMillis, TimeUnit.MILLISECONDS)) {
            if (halted()) {
                return false;
            }
        }
        return true;
    }

    private void work() {
        try {
            while (!cancelled) {
                RawRecord record = input.poll(pollMillis, TimeUnit.MILLISECONDS);
                if (record == null) {
                    if (producerDone && input.isEmpty()) {
                        break;
                    }
                    continue;
                }
                if (record.index() >= haltIndex) {
                    continue;
                }
                Document doc;
                try {
                    doc = converter.convert(record.fields(), record.tokens(), record.index());
                } catch (ConversionException e) {
                    fail(e, record.index());
                    continue;
                } catch (RuntimeException e) {
                    fail(new ConversionException(record.index(), String.valueOf(e.getMessage()), e), record.index());
                    continue;
                }
                if (reassembler != null) {
                    reassembler.complete(record.index(), doc);
                } else if (record.index() < haltIndex) {
                    emit(doc);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Decode worker failed: {}", e.getMessage(), e);
            fail(new ImportException("decode worker failed: " + e.getMessage(), e), -1);
        } finally {
            if (liveWorkers.decrementAndGet() == 0) {
                finish();
            }
        }
    }

    private boolean emit(Document doc) throws InterruptedException {
        while (!output.offer(doc, pollMillis, TimeUnit.MILLISECONDS)) {
            if (cancelled) {
                return false;
            }
        }
        emitted.increment();
        return true;
    }

    private void finish() {
        try {
            boolean sent = false;
            while (!sent && !cancelled) {
                sent = output.offer(END, pollMillis, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            executor.shutdown();
        }
        ImportException error = terminalError.get();
        if (error == null) {
            log.debug("Decode finished: {} documents from {} records", emitted.sum(), admitted);
        } else {
            log.debug("Decode stopped after {} documents: {}", emitted.sum(), error.getMessage());
        }
    }

    private synchronized void fail(ImportException error, long index) {
        long stopAt = index < 0 ? 0 : index;
        if (stopAt < haltIndex) {
            haltIndex = stopAt;
        }
        if (terminalError.compareAndSet(null, error)) {
            log.warn("Import halted: {}", error.getMessage());
        } else {
            log.debug("Suppressed error after halt: {}", error.getMessage());
        }
    }
}
