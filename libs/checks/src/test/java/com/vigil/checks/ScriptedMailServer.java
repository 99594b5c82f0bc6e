package com.vigil.checks;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * One-connection text protocol fake: writes a greeting, then answers each received line with the
 * lines the script returns. A null answer closes the connection.
 */
final class ScriptedMailServer implements AutoCloseable {

    private final ServerSocket server;
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final Thread thread;

    ScriptedMailServer(String greeting, Function<String, List<String>> script) throws IOException {
        this.server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        this.thread = new Thread(() -> serve(greeting, script), "scripted-mail");
        thread.setDaemon(true);
        thread.start();
    }

    int port() {
        return server.getLocalPort();
    }

    List<String> received() {
        return received;
    }

    private void serve(String greeting, Function<String, List<String>> script) {
        try (Socket socket = server.accept()) {
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
            OutputStream out = socket.getOutputStream();
            write(out, List.of(greeting));
            String line;
            while ((line = reader.readLine()) != null) {
                received.add(line);
                List<String> answer = script.apply(line);
                if (answer == null) {
                    return;
                }
                write(out, answer);
            }
        } catch (IOException e) {
            // client went away
        }
    }

    private static void write(OutputStream out, List<String> lines) throws IOException {
        for (String line : lines) {
            out.write((line + "\r\n").getBytes(StandardCharsets.US_ASCII));
        }
        out.flush();
    }

    @Override
    public void close() throws Exception {
        server.close();
        thread.join(2000);
    }
}
