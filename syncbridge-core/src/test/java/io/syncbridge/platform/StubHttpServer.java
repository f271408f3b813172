package io.syncbridge.platform;

import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Loopback HTTP server that records every request and answers with a scripted status and body.
 */
public final class StubHttpServer implements AutoCloseable {

  public record Request(String method, String path, String authorization, String contentType, String body) {
  }

  private final HttpServer server;
  private final List<Request> requests = new CopyOnWriteArrayList<>();
  private volatile int status = 200;
  private volatile String responseBody = "{\"ok\":true}";
  private final CountDownLatch latch = new CountDownLatch(1);
  private final AtomicBoolean stopped = new AtomicBoolean();

  public StubHttpServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/", exchange -> {
      String body;
      try (InputStream in = exchange.getRequestBody()) {
        body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      }
      requests.add(new Request(exchange.getRequestMethod(), exchange.getRequestURI().getPath(),
          exchange.getRequestHeaders().getFirst("Authorization"),
          exchange.getRequestHeaders().getFirst("Content-Type"), body));
      byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
      if (bytes.length == 0) {
        exchange.sendResponseHeaders(status, -1);
      } else {
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
          out.write(bytes);
        }
      }
      exchange.close();
      latch.countDown();
    });
    server.start();
  }

  public StubHttpServer respond(int status, String body) {
    this.status = status;
    this.responseBody = body;
    return this;
  }

  public String baseUrl() {
    return "http://127.0.0.1:" + server.getAddress().getPort();
  }

  public List<Request> requests() {
    return requests;
  }

  public Request last() {
    return requests.get(requests.size() - 1);
  }

  /** Waits for the first request to complete. */
  public boolean awaitRequest(long timeoutMs) throws InterruptedException {
    return latch.await(timeoutMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void close() {
    if (stopped.compareAndSet(false, true)) {
      server.stop(0);
    }
  }
}
