package com.darwinlink.support;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Loopback stand-in for a Darwin daemon port.
 *
 * Accepts one client at a time, records every command line it receives and
 * answers through a replaceable responder (command line -> reply lines).
 */
public class FakeDarwinDaemon implements AutoCloseable {

    private final ServerSocket server;
    private final BlockingQueue<String> received = new LinkedBlockingQueue<>();
    private final AtomicInteger connections = new AtomicInteger();
    private final Thread acceptThread;

    private volatile Function<String, List<String>> responder = line -> List.of();
    private volatile Socket client;
    private volatile BufferedWriter writer;

    public FakeDarwinDaemon() throws IOException {
        this.server = new ServerSocket(0, 5, InetAddress.getLoopbackAddress());
        this.acceptThread = new Thread(this::acceptLoop, "fake-darwin-" + server.getLocalPort());
        acceptThread.setDaemon(true);
        acceptThread.start();
    }

    public String host() {
        return server.getInetAddress().getHostAddress();
    }

    public int port() {
        return server.getLocalPort();
    }

    public void respondWith(Function<String, List<String>> responder) {
        this.responder = responder;
    }

    /**
     * Next command line from the client, or null after the timeout.
     */
    public String nextCommand(long timeoutMillis) throws InterruptedException {
        return received.poll(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    public int connectionCount() {
        return connections.get();
    }

    /**
     * Wait until a client has been accepted.
     */
    public boolean awaitClient(long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (writer == null) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    /**
     * Push lines the client did not ask for.
     */
    public synchronized void push(String... lines) throws IOException {
        try {
            awaitClient(2000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted waiting for a client", e);
        }
        BufferedWriter w = writer;
        if (w == null) {
            throw new IOException("No client connected");
        }
        for (String line : lines) {
            w.write(line);
            w.write('\n');
        }
        w.flush();
    }

    /**
     * Drop the current client as if the daemon went away.
     */
    public void dropClient() throws IOException {
        Socket s = client;
        if (s != null) {
            s.close();
        }
    }

    @Override
    public void close() throws IOException {
        dropClient();
        server.close();
    }

    private void acceptLoop() {
        while (!server.isClosed()) {
            try {
                Socket s = server.accept();
                client = s;
                writer = new BufferedWriter(new OutputStreamWriter(s.getOutputStream(), StandardCharsets.UTF_8));
                connections.incrementAndGet();
                serve(s);
            } catch (SocketException e) {
                return;
            } catch (IOException e) {
                throw new IllegalStateException("Fake daemon failed", e);
            }
        }
    }

    private void serve(Socket s) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                received.add(line);
                List<String> replies = responder.apply(line);
                if (!replies.isEmpty()) {
                    push(replies.toArray(new String[0]));
                }
            }
        } catch (SocketException e) {
            // Client or test closed the socket
        } finally {
            writer = null;
            s.close();
        }
    }
}
