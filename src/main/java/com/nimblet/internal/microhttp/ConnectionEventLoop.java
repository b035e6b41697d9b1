package com.nimblet.internal.microhttp;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Independent selector thread that owns a group of connections: reads, parses, hands requests to the
 * {@link MicrohttpHandler} and writes responses. All socket I/O and connection state changes happen on this
 * thread; other threads talk to it only through the task queue.
 * <p>
 * A connection moves READABLE → DISPATCHED (interest ops cleared, waiting for the handler) → WRITABLE → back
 * to READABLE for keep-alive, or CLOSED. A periodic sweep closes connections that stall before delivering a
 * request (request timeout) or sit idle between requests (idle timeout). Dispatched connections are exempt
 * from both.
 */
class ConnectionEventLoop {

    private static final String HTTP_1_0 = "HTTP/1.0";
    private static final String HTTP_1_1 = "HTTP/1.1";
    private static final String HEADER_CONNECTION = "Connection";
    private static final String HEADER_CONTENT_LENGTH = "Content-Length";
    private static final String KEEP_ALIVE = "Keep-Alive";
    private static final String CLOSE = "close";

    private static final byte[] BAD_REQUEST_RESPONSE =
            "HTTP/1.1 400 Bad Request\r\nConnection: close\r\nContent-Length: 0\r\n\r\n"
                    .getBytes(StandardCharsets.US_ASCII);
    private static final byte[] PAYLOAD_TOO_LARGE_RESPONSE =
            "HTTP/1.1 413 Payload Too Large\r\nConnection: close\r\nContent-Length: 0\r\n\r\n"
                    .getBytes(StandardCharsets.US_ASCII);

    private final Options options;
    private final Logger logger;
    private final MicrohttpHandler handler;
    private final ConnectionListener connectionListener;
    private final Clock clock;
    private final AtomicLong connectionCounter;
    private final AtomicBoolean stop;

    private final Scheduler scheduler;
    private final Queue<Runnable> taskQueue;
    private final ByteBuffer buffer;
    private final Selector selector;
    private final Thread thread;
    private final AtomicInteger connectionCount;

    ConnectionEventLoop(
            int index,
            Options options,
            Logger logger,
            MicrohttpHandler handler,
            ConnectionListener connectionListener,
            Clock clock,
            AtomicLong connectionCounter,
            AtomicBoolean stop) throws IOException {
        this.options = options;
        this.logger = logger;
        this.handler = handler;
        this.connectionListener = connectionListener;
        this.clock = clock;
        this.connectionCounter = connectionCounter;
        this.stop = stop;

        connectionCount = new AtomicInteger();
        scheduler = new Scheduler(clock);
        taskQueue = new ConcurrentLinkedQueue<>();
        buffer = ByteBuffer.allocateDirect(options.readBufferSize());
        selector = Selector.open();
        thread = new Thread(this::run, "nimblet-connection-loop-" + index);
    }

    private class Connection {
        final SocketChannel socketChannel;
        final SelectionKey selectionKey;
        final InetSocketAddress remoteAddress;
        final ByteTokenizer byteTokenizer;
        final String id;
        final long acceptedNanos;
        final AtomicBoolean closed;
        RequestParser requestParser;
        ByteBuffer writeBuffer;
        long lastActivityNanos;
        long requestStartNanos;
        long completedRequests;
        boolean dispatched;
        boolean httpOneDotZero;
        boolean keepAlive;
        boolean closeAfterResponse;

        Connection(SocketChannel socketChannel, SelectionKey selectionKey, InetSocketAddress remoteAddress) {
            this.socketChannel = socketChannel;
            this.selectionKey = selectionKey;
            this.remoteAddress = remoteAddress;
            this.byteTokenizer = new ByteTokenizer();
            this.id = Long.toString(connectionCounter.getAndIncrement());
            this.acceptedNanos = clock.nanoTime();
            this.lastActivityNanos = acceptedNanos;
            this.requestStartNanos = acceptedNanos;
            this.closed = new AtomicBoolean(false);
            this.requestParser = new RequestParser(byteTokenizer, remoteAddress);
        }

        void onReadable() {
            try {
                doOnReadable();
            } catch (MalformedRequestException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogField("event", "malformed_request"),
                            new LogField("id", id));
                }
                respondAndClose(BAD_REQUEST_RESPONSE);
            } catch (IOException | RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogField("event", "read_error"),
                            new LogField("id", id));
                }
                failSafeClose();
            }
        }

        private void doOnReadable() throws IOException {
            buffer.clear();
            int numBytes = socketChannel.read(buffer);
            if (numBytes < 0) {
                if (logger.enabled()) {
                    logger.log(
                            new LogField("event", "read_close"),
                            new LogField("id", id));
                }
                failSafeClose();
                return;
            }
            if (numBytes == 0) {
                return;
            }

            long now = clock.nanoTime();
            if (byteTokenizer.isEmpty() && completedRequests > 0) {
                requestStartNanos = now;
            }
            lastActivityNanos = now;

            buffer.flip();
            byteTokenizer.add(buffer);

            if (requestParser.parse()) {
                onParseRequest();
            } else if (byteTokenizer.size() > options.maxRequestSize()) {
                if (logger.enabled()) {
                    logger.log(
                            new LogField("event", "exceed_request_max_close"),
                            new LogField("id", id),
                            new LogField("request_size", Integer.toString(byteTokenizer.size())));
                }
                respondAndClose(PAYLOAD_TOO_LARGE_RESPONSE);
            }
        }

        private void onParseRequest() {
            if (selectionKey.interestOps() != 0) {
                selectionKey.interestOps(0);
            }
            MicrohttpRequest request = requestParser.request();
            applyConnectionPolicy(request);
            byteTokenizer.compact();
            requestParser = new RequestParser(byteTokenizer, remoteAddress);
            dispatched = true;

            if (logger.enabled()) {
                logger.log(
                        new LogField("event", "dispatch_request"),
                        new LogField("id", id),
                        new LogField("uri", request.uri()));
            }

            handler.handle(request, new ResponseCallback() {
                @Override
                public void respond(MicrohttpResponse response) {
                    enqueue(() -> onResponse(response));
                }

                @Override
                public void abort() {
                    enqueue(() -> {
                        if (logger.enabled()) {
                            logger.log(
                                    new LogField("event", "abort"),
                                    new LogField("id", id));
                        }
                        failSafeClose();
                    });
                }
            });
        }

        private void onResponse(MicrohttpResponse response) {
            if (closed.get() || !dispatched) {
                return;
            }
            try {
                prepareToWriteResponse(response);
            } catch (IOException | RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogField("event", "response_ready_error"),
                            new LogField("id", id));
                }
                failSafeClose();
            }
        }

        private void prepareToWriteResponse(MicrohttpResponse response) throws IOException {
            if (hasHeaderToken(response.headers(), HEADER_CONNECTION, CLOSE)) {
                closeAfterResponse = true;
            }
            String version = httpOneDotZero ? HTTP_1_0 : HTTP_1_1;
            List<Header> connectionHeaders = new ArrayList<>(2);
            if (httpOneDotZero && keepAlive && !closeAfterResponse) {
                connectionHeaders.add(new Header(HEADER_CONNECTION, KEEP_ALIVE));
            }
            if (closeAfterResponse && !response.hasHeader(HEADER_CONNECTION)) {
                connectionHeaders.add(new Header(HEADER_CONNECTION, CLOSE));
            }
            if (!response.hasHeader(HEADER_CONTENT_LENGTH)) {
                connectionHeaders.add(new Header(HEADER_CONTENT_LENGTH, Integer.toString(response.body().length)));
            }
            writeBuffer = ByteBuffer.wrap(response.serialize(version, connectionHeaders));
            doOnWritable();
        }

        private void respondAndClose(byte[] rawResponse) {
            if (selectionKey.isValid() && selectionKey.interestOps() != 0) {
                selectionKey.interestOps(0);
            }
            dispatched = true;
            closeAfterResponse = true;
            writeBuffer = ByteBuffer.wrap(rawResponse);
            try {
                doOnWritable();
            } catch (IOException e) {
                failSafeClose();
            }
        }

        void onWritable() {
            try {
                doOnWritable();
            } catch (IOException | RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogField("event", "write_error"),
                            new LogField("id", id));
                }
                failSafeClose();
            }
        }

        private int doWrite() throws IOException {
            buffer.clear();
            int amount = Math.min(buffer.remaining(), writeBuffer.remaining());
            buffer.put(writeBuffer.array(), writeBuffer.position(), amount);
            buffer.flip();
            int written = socketChannel.write(buffer);
            writeBuffer.position(writeBuffer.position() + written);
            return written;
        }

        private void doOnWritable() throws IOException {
            int numBytes = doWrite();
            lastActivityNanos = clock.nanoTime();

            if (writeBuffer.hasRemaining()) {
                if ((selectionKey.interestOps() & SelectionKey.OP_WRITE) == 0) {
                    selectionKey.interestOps(SelectionKey.OP_WRITE);
                }
                return;
            }

            writeBuffer = null;
            dispatched = false;
            completedRequests++;

            if (logger.enabled()) {
                logger.log(
                        new LogField("event", "write_response"),
                        new LogField("id", id),
                        new LogField("num_bytes", Integer.toString(numBytes)));
            }

            if (closeAfterResponse) {
                failSafeClose();
            } else if (requestParser.parse()) {
                // pipelined request already buffered
                requestStartNanos = lastActivityNanos;
                onParseRequest();
            } else {
                requestStartNanos = lastActivityNanos;
                selectionKey.interestOps(SelectionKey.OP_READ);
            }
        }

        void sweep(long now) {
            if (closed.get() || dispatched || writeBuffer != null) {
                return;
            }

            boolean partialRequest = !byteTokenizer.isEmpty();

            if (partialRequest || completedRequests == 0) {
                if (now - requestStartNanos > options.requestTimeout().toNanos()) {
                    if (logger.enabled()) {
                        logger.log(
                                new LogField("event", "request_timeout"),
                                new LogField("id", id));
                    }
                    connectionListener.didTimeOutRequest(remoteAddress);
                    failSafeClose();
                }
            } else if (now - lastActivityNanos > options.idleTimeout().toNanos()) {
                if (logger.enabled()) {
                    logger.log(
                            new LogField("event", "idle_disconnect"),
                            new LogField("id", id));
                }
                connectionListener.didDisconnectIdleConnection(remoteAddress);
                failSafeClose();
            }
        }

        void failSafeClose() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            selectionKey.cancel();
            CloseUtils.closeQuietly(socketChannel, logger);
            connectionCount.decrementAndGet();
            connectionListener.didCloseConnection(remoteAddress);
        }

        private void applyConnectionPolicy(MicrohttpRequest request) {
            closeAfterResponse = false;
            httpOneDotZero = request.version().equalsIgnoreCase(HTTP_1_0);

            if (hasHeaderToken(request.headers(), HEADER_CONNECTION, CLOSE)) {
                keepAlive = false;
                closeAfterResponse = true;
            } else if (httpOneDotZero) {
                keepAlive = hasHeaderToken(request.headers(), HEADER_CONNECTION, KEEP_ALIVE);
                closeAfterResponse = !keepAlive;
            } else {
                keepAlive = true;
            }
        }
    }

    private static boolean hasHeaderToken(List<Header> headers, String name, String token) {
        for (Header header : headers) {
            if (!header.name().equalsIgnoreCase(name) || header.value() == null) {
                continue;
            }
            for (String part : header.value().split(",")) {
                if (token.equalsIgnoreCase(part.trim())) {
                    return true;
                }
            }
        }
        return false;
    }

    int numConnections() {
        return connectionCount.get();
    }

    void start() {
        scheduler.schedule(this::sweep, options.sweepInterval());
        thread.start();
    }

    void wakeup() {
        selector.wakeup();
    }

    void join() throws InterruptedException {
        thread.join();
    }

    void join(long millis) throws InterruptedException {
        thread.join(millis);
    }

    void closeSelector() {
        CloseUtils.closeQuietly(selector, logger);
    }

    void register(SocketChannel socketChannel, InetSocketAddress remoteAddress) {
        connectionCount.incrementAndGet();
        enqueue(() -> {
            try {
                doRegister(socketChannel, remoteAddress);
            } catch (IOException | RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e, new LogField("event", "register_error"));
                }
                connectionCount.decrementAndGet();
                CloseUtils.closeQuietly(socketChannel, logger);
            }
        });
    }

    private void enqueue(Runnable task) {
        taskQueue.add(task);
        // tasks queued from the loop thread are drained at the end of the current iteration
        if (Thread.currentThread() != thread) {
            selector.wakeup();
        }
    }

    private void doRegister(SocketChannel socketChannel, InetSocketAddress remoteAddress) throws IOException {
        socketChannel.configureBlocking(false);
        SelectionKey selectionKey = socketChannel.register(selector, SelectionKey.OP_READ);
        Connection connection = new Connection(socketChannel, selectionKey, remoteAddress);
        selectionKey.attach(connection);
        connectionListener.didAcceptConnection(remoteAddress);
        if (logger.enabled()) {
            logger.log(
                    new LogField("event", "accept"),
                    new LogField("remote_address", String.valueOf(remoteAddress)),
                    new LogField("id", connection.id));
        }
    }

    private void sweep() {
        long now = clock.nanoTime();
        for (SelectionKey selectionKey : selector.keys()) {
            if (selectionKey.attachment() instanceof Connection connection) {
                connection.sweep(now);
            }
        }
        scheduler.schedule(this::sweep, options.sweepInterval());
    }

    private void run() {
        try {
            doRun();
        } catch (IOException | RuntimeException e) {
            if (logger.enabled()) {
                logger.log(e, new LogField("event", "connection_loop_terminate"));
            }
            stop.set(true);
        } finally {
            for (SelectionKey selectionKey : selector.keys()) {
                if (selectionKey.attachment() instanceof Connection connection) {
                    connection.failSafeClose();
                }
            }
            Runnable task;
            while ((task = taskQueue.poll()) != null) {
                // registrations still queued at shutdown must release their sockets
                task.run();
            }
            for (SelectionKey selectionKey : selector.keys()) {
                if (selectionKey.attachment() instanceof Connection connection) {
                    connection.failSafeClose();
                }
            }
            CloseUtils.closeQuietly(selector, logger);
        }
    }

    private void doRun() throws IOException {
        while (!stop.get()) {
            selector.select(options.resolution().toMillis());
            Iterator<SelectionKey> it = selector.selectedKeys().iterator();
            while (it.hasNext()) {
                SelectionKey selectionKey = it.next();
                it.remove();
                if (!selectionKey.isValid()) {
                    continue;
                }
                Connection connection = (Connection) selectionKey.attachment();
                if (selectionKey.isReadable()) {
                    connection.onReadable();
                } else if (selectionKey.isWritable()) {
                    connection.onWritable();
                }
            }
            scheduler.expired().forEach(Runnable::run);
            Runnable task;
            while ((task = taskQueue.poll()) != null) {
                task.run();
            }
        }
    }
}
