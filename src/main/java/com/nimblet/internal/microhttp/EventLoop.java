package com.nimblet.internal.microhttp;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accepting side of the engine. Owns the listening socket and a fixed set of {@link ConnectionEventLoop}s;
 * each accepted socket is handed to the loop currently holding the fewest connections.
 */
public class EventLoop {

    private final Options options;
    private final Logger logger;
    private final ConnectionListener connectionListener;

    private final Selector selector;
    private final AtomicBoolean stop;
    private final ServerSocketChannel serverSocketChannel;
    private final List<ConnectionEventLoop> connectionEventLoops;
    private final Thread thread;

    public EventLoop(Options options, Logger logger, MicrohttpHandler handler, ConnectionListener connectionListener) throws IOException {
        this.options = options;
        this.logger = logger;
        this.connectionListener = connectionListener == null ? NoopConnectionListener.instance() : connectionListener;

        stop = new AtomicBoolean();
        selector = Selector.open();

        AtomicLong connectionCounter = new AtomicLong();
        connectionEventLoops = new ArrayList<>(options.concurrency());
        for (int i = 0; i < options.concurrency(); i++) {
            connectionEventLoops.add(new ConnectionEventLoop(
                    i, options, logger, handler, this.connectionListener, new SystemClock(), connectionCounter, stop));
        }

        thread = new Thread(this::run, "nimblet-acceptor");

        InetSocketAddress address = options.host() == null
                ? new InetSocketAddress(options.port())
                : new InetSocketAddress(options.host(), options.port());

        serverSocketChannel = ServerSocketChannel.open();
        try {
            if (options.reuseAddr()) {
                serverSocketChannel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            }
            serverSocketChannel.configureBlocking(false);
            serverSocketChannel.bind(address, options.acceptLength());
            serverSocketChannel.register(selector, SelectionKey.OP_ACCEPT);
        } catch (IOException | RuntimeException e) {
            CloseUtils.closeQuietly(serverSocketChannel, logger);
            CloseUtils.closeQuietly(selector, logger);
            for (ConnectionEventLoop connectionEventLoop : connectionEventLoops) {
                connectionEventLoop.closeSelector();
            }
            throw e;
        }
    }

    public int getPort() throws IOException {
        return serverSocketChannel.getLocalAddress() instanceof InetSocketAddress a ? a.getPort() : -1;
    }

    public void start() {
        connectionEventLoops.forEach(ConnectionEventLoop::start);
        thread.start();
    }

    public void stop() {
        stop.set(true);
        selector.wakeup();
        connectionEventLoops.forEach(ConnectionEventLoop::wakeup);
    }

    public void join() throws InterruptedException {
        thread.join();
        for (ConnectionEventLoop connectionEventLoop : connectionEventLoops) {
            connectionEventLoop.join();
        }
    }

    /**
     * Waits up to {@code millis} overall for the acceptor and every connection loop to exit.
     */
    public void join(long millis) throws InterruptedException {
        long deadline = System.nanoTime() + millis * 1_000_000L;
        thread.join(Math.max(1L, millis));
        for (ConnectionEventLoop connectionEventLoop : connectionEventLoops) {
            long remaining = (deadline - System.nanoTime()) / 1_000_000L;
            connectionEventLoop.join(Math.max(1L, remaining));
        }
    }

    public int numConnections() {
        int total = 0;
        for (ConnectionEventLoop loop : connectionEventLoops) {
            total += loop.numConnections();
        }
        return total;
    }

    private void run() {
        try {
            doRun();
        } catch (IOException | RuntimeException e) {
            if (logger.enabled()) {
                logger.log(e, new LogField("event", "event_loop_terminate"));
            }
            stop.set(true);
            connectionEventLoops.forEach(ConnectionEventLoop::wakeup);
        } finally {
            CloseUtils.closeQuietly(selector, logger);
            CloseUtils.closeQuietly(serverSocketChannel, logger);
        }
    }

    private void doRun() throws IOException {
        while (!stop.get()) {
            selector.select(options.resolution().toMillis());
            Iterator<SelectionKey> it = selector.selectedKeys().iterator();
            while (it.hasNext()) {
                SelectionKey selectionKey = it.next();
                it.remove();
                if (selectionKey.isValid() && selectionKey.isAcceptable()) {
                    accept();
                }
            }
        }
    }

    private void accept() throws IOException {
        SocketChannel socketChannel = serverSocketChannel.accept();
        if (socketChannel == null) {
            return;
        }

        InetSocketAddress remoteAddress = remoteAddress(socketChannel);

        if (options.maxConnections() > 0 && numConnections() >= options.maxConnections()) {
            if (logger.enabled()) {
                logger.log(
                        new LogField("event", "accept_reject_max_connections"),
                        new LogField("max_connections", Integer.toString(options.maxConnections())));
            }
            connectionListener.didFailToAcceptConnection(remoteAddress);
            CloseUtils.closeQuietly(socketChannel, logger);
            return;
        }

        leastConnections().register(socketChannel, remoteAddress);
    }

    private InetSocketAddress remoteAddress(SocketChannel socketChannel) {
        try {
            SocketAddress socketAddress = socketChannel.getRemoteAddress();
            return socketAddress instanceof InetSocketAddress inetSocketAddress ? inetSocketAddress : null;
        } catch (IOException e) {
            if (logger.enabled()) {
                logger.log(e, new LogField("event", "remote_address_unavailable"));
            }
            return null;
        }
    }

    private ConnectionEventLoop leastConnections() {
        return connectionEventLoops.stream()
                .min(Comparator.comparingInt(ConnectionEventLoop::numConnections))
                .orElseThrow();
    }
}
