package com.vigil.checks;

import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented client connection for the text mail protocols. Lines are CRLF-terminated ASCII.
 */
final class MailSession implements Closeable {

    private Socket socket;
    private BufferedReader reader;
    private BufferedWriter writer;

    private MailSession(Socket socket) throws IOException {
        attach(socket);
    }

    /**
     * Connects to a mail server, optionally wrapping the connection in TLS from the start.
     */
    static MailSession open(String host, int port, Duration timeout, SSLSocketFactory tls) throws IOException {
        Socket plain = new Socket();
        try {
            plain.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            plain.setSoTimeout((int) timeout.toMillis());
            Socket socket = plain;
            if (tls != null) {
                SSLSocket secure = (SSLSocket) tls.createSocket(plain, host, port, true);
                secure.startHandshake();
                socket = secure;
            }
            return new MailSession(socket);
        } catch (IOException e) {
            plain.close();
            throw e;
        }
    }

    /**
     * Upgrades the open connection to TLS after a successful STARTTLS exchange.
     */
    void startTls(SSLSocketFactory tls, String host, int port) throws IOException {
        SSLSocket secure = (SSLSocket) tls.createSocket(socket, host, port, true);
        secure.startHandshake();
        attach(secure);
    }

    String localAddress() {
        return socket.getLocalAddress().getHostAddress();
    }

    String remoteAddress() {
        return socket.getInetAddress().getHostAddress();
    }

    void send(String line) throws IOException {
        writer.write(line);
        writer.write("\r\n");
        writer.flush();
    }

    String readLine() throws IOException {
        String line = reader.readLine();
        if (line == null) {
            throw new EOFException("Connection closed by server");
        }
        return line;
    }

    /**
     * Reads an SMTP reply, following {@code NNN-} continuation lines.
     */
    SmtpReply readSmtpReply() throws IOException {
        List<String> lines = new ArrayList<>();
        while (true) {
            String line = readLine();
            if (line.length() < 3) {
                throw new IOException("Malformed SMTP reply: " + line);
            }
            int code;
            try {
                code = Integer.parseInt(line.substring(0, 3));
            } catch (NumberFormatException e) {
                throw new IOException("Malformed SMTP reply: " + line, e);
            }
            lines.add(line.length() > 4 ? line.substring(4) : "");
            if (line.length() == 3 || line.charAt(3) != '-') {
                return new SmtpReply(code, lines);
            }
        }
    }

    SmtpReply smtp(String command) throws IOException {
        send(command);
        return readSmtpReply();
    }

    /**
     * Sends a tagged IMAP command and collects untagged responses until the tagged completion.
     */
    ImapReply imap(String tag, String command) throws IOException {
        send(tag + " " + command);
        List<String> untagged = new ArrayList<>();
        while (true) {
            String line = readLine();
            if (line.startsWith(tag + " ")) {
                return new ImapReply(untagged, line.substring(tag.length() + 1));
            }
            untagged.add(line);
        }
    }

    /**
     * Reads a POP3 multi-line body terminated by a lone dot.
     */
    List<String> readPopLines() throws IOException {
        List<String> lines = new ArrayList<>();
        while (true) {
            String line = readLine();
            if (".".equals(line)) {
                return lines;
            }
            lines.add(line.startsWith("..") ? line.substring(1) : line);
        }
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    private void attach(Socket connected) throws IOException {
        this.socket = connected;
        this.reader = new BufferedReader(new InputStreamReader(connected.getInputStream(), StandardCharsets.US_ASCII));
        this.writer = new BufferedWriter(new OutputStreamWriter(connected.getOutputStream(), StandardCharsets.US_ASCII));
    }

    record SmtpReply(int code, List<String> lines) {

        String text() {
            return String.join("\n", lines);
        }

        @Override
        public String toString() {
            return code + " " + String.join(" ", lines);
        }
    }

    record ImapReply(List<String> untagged, String completion) {

        boolean ok() {
            return completion.regionMatches(true, 0, "OK", 0, 2);
        }
    }
}
