package io.liarslie.net;

import io.liarslie.codec.Envelope;
import io.liarslie.codec.EnvelopeCodec;
import io.liarslie.codec.Frames;
import io.liarslie.config.LiarsLieConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * One request per connection: connect, write a framed envelope, optionally read a framed reply, close.
 */
public final class PeerChannel {
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final int maxFrameBytes;

    public PeerChannel(int connectTimeoutMs, int readTimeoutMs, int maxFrameBytes) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.maxFrameBytes = maxFrameBytes;
    }

    public static PeerChannel from(LiarsLieConfig config) {
        return new PeerChannel(config.connectTimeoutMs(), config.readTimeoutMs(), config.maxFrameBytes());
    }

    public Envelope request(String host, int port, Envelope request) throws IOException {
        try (Socket socket = open(host, port)) {
            OutputStream out = socket.getOutputStream();
            Frames.write(out, EnvelopeCodec.encode(request));
            InputStream in = socket.getInputStream();
            byte[] reply = Frames.deframe(in, maxFrameBytes);
            return EnvelopeCodec.decode(reply);
        }
    }

    public void send(String host, int port, Envelope message) throws IOException {
        try (Socket socket = open(host, port)) {
            Frames.write(socket.getOutputStream(), EnvelopeCodec.encode(message));
        }
    }

    public int maxFrameBytes() {
        return maxFrameBytes;
    }

    // Longest a request() to a peer that connects and then stays silent can block.
    public int exchangeBudgetMs() {
        return connectTimeoutMs + readTimeoutMs;
    }

    public PeerChannel withReadTimeout(int readTimeoutMs) {
        return new PeerChannel(connectTimeoutMs, readTimeoutMs, maxFrameBytes);
    }

    private Socket open(String host, int port) throws IOException {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            socket.setSoTimeout(readTimeoutMs);
            return socket;
        } catch (IOException e) {
            socket.close();
            throw new IOException("unable to reach " + host + ":" + port + " - " + e.getMessage(), e);
        }
    }
}
