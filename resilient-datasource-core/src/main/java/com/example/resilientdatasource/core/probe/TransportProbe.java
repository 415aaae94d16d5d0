package com.example.resilientdatasource.core.probe;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.resilientdatasource.core.probe.ProbeResult.ProbeFailure;
import java.io.IOException;
import java.lang.System.Logger;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Locale;

/**
 * Raw TCP reachability check, run before a full database handshake so that a dead network path
 * fails within a few seconds instead of burning the longer protocol timeout.
 *
 * <p>Never throws; the socket is closed on every path.
 */
public class TransportProbe {

  private static final Logger logger = System.getLogger(TransportProbe.class.getName());

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);

  /**
   * Attempts a TCP connection to {@code host:port}.
   *
   * @param host target host
   * @param port target port
   * @param timeout connect timeout
   * @return probe outcome
   */
  public ProbeResult probe(final String host, final int port, final Duration timeout) {
    final var start = System.nanoTime();
    try (final var socket = new Socket()) {
      socket.connect(new InetSocketAddress(host, port), (int) Math.max(1L, timeout.toMillis()));
      final var result = ProbeResult.success(since(start));
      logger.log(
          DEBUG,
          "Socket probe to {0}:{1} ok in {2} ms",
          host,
          String.valueOf(port),
          result.elapsed().toMillis());
      return result;
    } catch (final SocketTimeoutException e) {
      return failed(host, port, ProbeFailure.TIMEOUT, start, e);
    } catch (final ConnectException e) {
      final var message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
      if (message.contains("refused")) return failed(host, port, ProbeFailure.REFUSED, start, e);
      if (message.contains("timed out")) return failed(host, port, ProbeFailure.TIMEOUT, start, e);
      return failed(host, port, ProbeFailure.UNKNOWN, start, e);
    } catch (final IOException | IllegalArgumentException | SecurityException e) {
      return failed(host, port, ProbeFailure.UNKNOWN, start, e);
    }
  }

  private static ProbeResult failed(
      final String host,
      final int port,
      final ProbeFailure failure,
      final long start,
      final Exception cause) {
    final var result = ProbeResult.failure(failure, since(start), cause);
    logger.log(
        DEBUG,
        "Socket probe to {0}:{1} failed: {2}",
        host,
        String.valueOf(port),
        result.describe());
    return result;
  }

  private static Duration since(final long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
