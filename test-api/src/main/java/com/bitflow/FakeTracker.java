package com.bitflow;

import org.simpleframework.http.Request;
import org.simpleframework.http.Response;
import org.simpleframework.http.core.Container;
import org.simpleframework.transport.connect.Connection;
import org.simpleframework.transport.connect.SocketConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A scripted HTTP tracker on the loopback interface.
 *
 * <p>
 * Every request to {@code /announce} is recorded and answered with the
 * configured status and body. Requests to {@code /moved} are redirected to
 * {@code /announce}.
 * </p>
 */
public class FakeTracker implements Container {

  private static final Logger logger = LoggerFactory.getLogger(FakeTracker.class);

  public static final String ANNOUNCE_PATH = "/announce";
  public static final String REDIRECT_PATH = "/moved";

  private final List<String> requests = new CopyOnWriteArrayList<String>();
  private volatile int status = 200;
  private volatile byte[] body = new byte[0];

  private Connection connection;
  private int port;

  public void start() throws IOException {
    ServerSocket portFinder = new ServerSocket(0);
    try {
      this.port = portFinder.getLocalPort();
    } finally {
      portFinder.close();
    }
    this.connection = new SocketConnection(this);
    this.connection.connect(new InetSocketAddress("127.0.0.1", this.port));
    logger.debug("Fake tracker listening on port {}", this.port);
  }

  public void stop() throws IOException {
    if (this.connection != null) {
      this.connection.close();
    }
  }

  public URI getAnnounceURI() {
    return getURI(ANNOUNCE_PATH);
  }

  public URI getURI(String path) {
    return URI.create("http://127.0.0.1:" + this.port + path);
  }

  public void respondWith(int status, byte[] body) {
    this.status = status;
    this.body = body.clone();
  }

  /**
   * Raw request targets (path and query) received on the announce path, in
   * arrival order.
   */
  public List<String> getRequests() {
    return this.requests;
  }

  @Override
  public void handle(Request request, Response response) {
    try {
      String path = request.getPath().getPath();
      if (REDIRECT_PATH.equals(path)) {
        String target = request.getTarget();
        int query = target.indexOf('?');
        response.setCode(302);
        response.setText("Found");
        response.setValue("Location", ANNOUNCE_PATH + (query < 0 ? "" : target.substring(query)));
        response.close();
        return;
      }
      if (!ANNOUNCE_PATH.equals(path)) {
        response.setCode(404);
        response.setText("Not Found");
        response.close();
        return;
      }

      this.requests.add(request.getTarget());
      response.setCode(this.status);
      response.setText(this.status == 200 ? "OK" : "Error");
      response.setValue("Content-Type", "text/plain");
      OutputStream out = response.getOutputStream();
      out.write(this.body);
      out.close();
    } catch (IOException ioe) {
      logger.warn("Fake tracker could not answer", ioe);
    }
  }
}
