package fr.lapetina.clusterclient.infrastructure.transport.binary;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs a connection against a loopback server that answers on demand.
 */
class BinaryConnectionTest {

    private ServerSocket server;
    private Socket peer;
    private DataInputStream peerIn;
    private OutputStream peerOut;
    private BinaryConnection connection;

    @BeforeEach
    void setUp() throws Exception {
        server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        CompletableFuture<BinaryConnection> connecting = BinaryConnection.connect(
                "127.0.0.1", server.getLocalPort(), Duration.ofSeconds(2));
        peer = server.accept();
        peerIn = new DataInputStream(peer.getInputStream());
        peerOut = peer.getOutputStream();
        connection = connecting.get(2, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown() throws IOException {
        connection.close();
        peer.close();
        server.close();
    }

    private BinaryFrame readRequest() throws IOException {
        byte[] header = new byte[BinaryFrameCodec.HEADER_LENGTH];
        peerIn.readFully(header);
        int bodyLength = ByteBuffer.wrap(header).getInt(8);
        byte[] packet = new byte[header.length + bodyLength];
        System.arraycopy(header, 0, packet, 0, header.length);
        peerIn.readFully(packet, header.length, bodyLength);
        return BinaryFrameCodec.decode(ByteBuffer.wrap(packet)).orElseThrow();
    }

    private void reply(BinaryFrame request, int status, String value) throws IOException {
        BinaryFrame response = new BinaryFrame(BinaryOpcodes.RESPONSE_MAGIC, request.opcode(), status,
                request.opaque(), 0L, null, null, value.getBytes());
        ByteBuffer encoded = BinaryFrameCodec.encode(response);
        byte[] bytes = new byte[encoded.remaining()];
        encoded.get(bytes);
        peerOut.write(bytes);
        peerOut.flush();
    }

    @Test
    @DisplayName("should correlate responses arriving out of order")
    void shouldCorrelateByOpaque() throws Exception {
        CompletableFuture<BinaryFrame> first = connection.send(BinaryFrame.request(BinaryOpcodes.GET, "a", null));
        CompletableFuture<BinaryFrame> second = connection.send(BinaryFrame.request(BinaryOpcodes.GET, "b", null));

        BinaryFrame requestA = readRequest();
        BinaryFrame requestB = readRequest();
        reply(requestB, BinaryStatus.SUCCESS, "value-b");
        reply(requestA, BinaryStatus.SUCCESS, "value-a");

        assertThat(first.get(2, TimeUnit.SECONDS).valueAsString()).isEqualTo("value-a");
        assertThat(second.get(2, TimeUnit.SECONDS).valueAsString()).isEqualTo("value-b");
        assertThat(connection.inFlightCount()).isZero();
    }

    @Test
    @DisplayName("should drop the response of a cancelled request and stay usable")
    void shouldDropOrphanedResponse() throws Exception {
        CompletableFuture<BinaryFrame> abandoned = connection.send(BinaryFrame.request(BinaryOpcodes.GET, "slow", null));
        BinaryFrame slowRequest = readRequest();
        abandoned.cancel(false);
        assertThat(connection.inFlightCount()).isZero();

        reply(slowRequest, BinaryStatus.SUCCESS, "too late");
        CompletableFuture<BinaryFrame> next = connection.send(BinaryFrame.request(BinaryOpcodes.GET, "fast", null));
        reply(readRequest(), BinaryStatus.SUCCESS, "in time");

        assertThat(next.get(2, TimeUnit.SECONDS).valueAsString()).isEqualTo("in time");
        assertThat(connection.orphanedCount()).isEqualTo(1);
        assertThat(connection.isOpen()).isTrue();
    }

    @Test
    @DisplayName("should fail requests in flight when the peer closes the socket")
    void shouldFailInFlightOnPeerClose() throws Exception {
        List<CompletableFuture<BinaryFrame>> pending = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            pending.add(connection.send(BinaryFrame.request(BinaryOpcodes.GET, "k" + i, null)));
        }
        readRequest();

        peer.close();

        for (CompletableFuture<BinaryFrame> future : pending) {
            assertThatThrownBy(() -> future.get(2, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .satisfies(e -> assertThat(((OperationException) e.getCause()).getRetryReason())
                            .isEqualTo(RetryReason.SOCKET_CLOSED_WHILE_IN_FLIGHT));
        }
        assertThat(connection.isOpen()).isFalse();
    }

    @Test
    @DisplayName("should refuse new requests once closed")
    void shouldRefuseAfterClose() {
        connection.close();

        CompletableFuture<BinaryFrame> refused = connection.send(BinaryFrame.request(BinaryOpcodes.NOOP, "", null));

        assertThat(refused).isCompletedExceptionally();
    }

    @Test
    @DisplayName("should report an unreachable endpoint as socket not available")
    void shouldFailToConnect() throws Exception {
        int port;
        try (ServerSocket unused = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = unused.getLocalPort();
        }

        CompletableFuture<BinaryConnection> connecting = BinaryConnection.connect("127.0.0.1", port, Duration.ofSeconds(2));

        assertThatThrownBy(() -> connecting.get(3, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .satisfies(e -> assertThat(((OperationException) e.getCause()).getRetryReason())
                        .isEqualTo(RetryReason.SOCKET_NOT_AVAILABLE));
    }

    @Test
    @DisplayName("should deliver many concurrent requests on one connection")
    void shouldMultiplex() throws Exception {
        int count = 50;
        List<CompletableFuture<BinaryFrame>> futures = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            futures.add(connection.send(BinaryFrame.request(BinaryOpcodes.GET, "key-" + i, null)));
        }

        List<BinaryFrame> requests = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            requests.add(readRequest());
        }
        for (int i = requests.size() - 1; i >= 0; i--) {
            BinaryFrame request = requests.get(i);
            reply(request, BinaryStatus.SUCCESS, new String(request.key()));
        }

        for (int i = 0; i < count; i++) {
            assertThat(futures.get(i).get(2, TimeUnit.SECONDS).valueAsString()).isEqualTo("key-" + i);
        }
    }
}
