package fr.lapetina.clusterclient.infrastructure.transport.binary;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.infrastructure.auth.PasswordAuthenticator;
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
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the pool against a loopback server accepting every handshake.
 */
class BinaryConnectionPoolTest {

    private ServerSocket server;
    private final List<Socket> peers = new CopyOnWriteArrayList<>();
    private final AtomicInteger handshakes = new AtomicInteger();
    private BinaryConnectionPool pool;

    @BeforeEach
    void setUp() throws Exception {
        server = new ServerSocket(0, 8, InetAddress.getLoopbackAddress());
        Thread acceptor = new Thread(this::acceptLoop, "pool-test-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        pool = new BinaryConnectionPool(2, Duration.ofSeconds(2),
                new PasswordAuthenticator("tester", "secret"), "test-bucket");
    }

    @AfterEach
    void tearDown() throws IOException {
        pool.close();
        server.close();
        for (Socket peer : peers) {
            peer.close();
        }
    }

    private void acceptLoop() {
        try {
            while (!server.isClosed()) {
                Socket peer = server.accept();
                peers.add(peer);
                Thread responder = new Thread(() -> answerAll(peer), "pool-test-peer");
                responder.setDaemon(true);
                responder.start();
            }
        } catch (IOException e) {
            // server closed
        }
    }

    private void answerAll(Socket peer) {
        try {
            DataInputStream in = new DataInputStream(peer.getInputStream());
            OutputStream out = peer.getOutputStream();
            while (true) {
                byte[] header = new byte[BinaryFrameCodec.HEADER_LENGTH];
                in.readFully(header);
                int bodyLength = ByteBuffer.wrap(header).getInt(8);
                byte[] packet = new byte[header.length + bodyLength];
                System.arraycopy(header, 0, packet, 0, header.length);
                in.readFully(packet, header.length, bodyLength);
                BinaryFrame request = BinaryFrameCodec.decode(ByteBuffer.wrap(packet)).orElseThrow();
                if (request.opcode() == BinaryOpcodes.SELECT_BUCKET) {
                    handshakes.incrementAndGet();
                }
                BinaryFrame response = new BinaryFrame(BinaryOpcodes.RESPONSE_MAGIC, request.opcode(),
                        BinaryStatus.SUCCESS, request.opaque(), 0L, null, null, new byte[0]);
                ByteBuffer encoded = BinaryFrameCodec.encode(response);
                byte[] bytes = new byte[encoded.remaining()];
                encoded.get(bytes);
                out.write(bytes);
                out.flush();
            }
        } catch (IOException e) {
            // peer closed
        }
    }

    private String endpoint() {
        return "127.0.0.1:" + server.getLocalPort();
    }

    @Test
    @DisplayName("should spread acquisitions over the connections of an endpoint")
    void shouldRotateOverSlots() throws Exception {
        CompletableFuture<BinaryConnection> first = pool.acquire("127.0.0.1", server.getLocalPort());
        CompletableFuture<BinaryConnection> second = pool.acquire("127.0.0.1", server.getLocalPort());
        CompletableFuture<BinaryConnection> third = pool.acquire("127.0.0.1", server.getLocalPort());

        assertThat(first.get(2, TimeUnit.SECONDS)).isNotSameAs(second.get(2, TimeUnit.SECONDS));
        assertThat(third).isSameAs(first);
        assertThat(first.get().isOpen()).isTrue();
        assertThat(handshakes).hasValue(2);
        assertThat(pool.endpointCount()).isEqualTo(1);
        assertThat(pool.inFlight(endpoint())).isZero();
    }

    @Test
    @DisplayName("should reopen a slot whose connection closed")
    void shouldReopenClosedSlot() throws Exception {
        BinaryConnection connection = pool.acquire("127.0.0.1", server.getLocalPort()).get(2, TimeUnit.SECONDS);
        pool.acquire("127.0.0.1", server.getLocalPort()).get(2, TimeUnit.SECONDS);
        connection.close();

        BinaryConnection reopened = pool.acquire("127.0.0.1", server.getLocalPort()).get(2, TimeUnit.SECONDS);

        assertThat(reopened).isNotSameAs(connection);
        assertThat(reopened.isOpen()).isTrue();
        assertThat(handshakes).hasValue(3);
    }

    @Test
    @DisplayName("should reopen a slot whose connection attempt failed")
    void shouldReopenFailedSlot() throws Exception {
        int port;
        try (ServerSocket unused = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = unused.getLocalPort();
        }
        BinaryConnectionPool single = new BinaryConnectionPool(1, Duration.ofSeconds(1),
                new PasswordAuthenticator("tester", "secret"), "test-bucket");
        try {
            CompletableFuture<BinaryConnection> failed = single.acquire("127.0.0.1", port);
            assertThatThrownBy(() -> failed.get(3, TimeUnit.SECONDS)).isInstanceOf(ExecutionException.class);

            assertThat(single.acquire("127.0.0.1", port)).isNotSameAs(failed);
        } finally {
            single.close();
        }
    }

    @Test
    @DisplayName("should close connections of departed endpoints")
    void shouldCloseDepartedEndpoints() throws Exception {
        BinaryConnection connection = pool.acquire("127.0.0.1", server.getLocalPort()).get(2, TimeUnit.SECONDS);

        pool.retainEndpoints(Set.of(endpoint()));
        assertThat(pool.endpointCount()).isEqualTo(1);

        pool.retainEndpoints(Set.of());

        assertThat(pool.endpointCount()).isZero();
        assertThat(connection.isOpen()).isFalse();
    }

    @Test
    @DisplayName("should refuse acquisitions once closed")
    void shouldRefuseAfterClose() {
        pool.close();

        CompletableFuture<BinaryConnection> refused = pool.acquire("127.0.0.1", server.getLocalPort());

        assertThatThrownBy(() -> refused.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .satisfies(e -> assertThat(((OperationException) e.getCause()).getErrorType())
                        .isEqualTo(ErrorType.REQUEST_CANCELED));
    }
}
