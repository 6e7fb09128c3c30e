package com.chauhraj.kdbtick;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chauhraj.kdbtick.config.ConfigurationLoader;
import com.chauhraj.kdbtick.config.ConnectionSettings;

/**
 * Factory class for creating kdb+ client instances from connection URLs.
 * Supported schemes:
 * - kdb://[user[:password]@]host:port   (plain TCP)
 * - kdbs://[user[:password]@]host:port  (TLS)
 * Settings not given in the URL come from the loaded configuration.
 */
public class ClientFactory {

  private static final Logger logger = LoggerFactory.getLogger(ClientFactory.class);

  private ClientFactory() {
    // Prevent instantiation
  }

  /**
   * Creates a Client for the given URL. The client connects on its first send.
   *
   * @param url Connection URL in the format scheme://[user[:password]@]host:port
   * @return A Client instance
   * @throws IllegalArgumentException if the URL is malformed or unsupported
   */
  public static Client createClient(String url) {
    return createClient(url, new ConfigurationLoader().getSettings());
  }

  static Client createClient(String url, ConnectionSettings defaults) {
    return new Client(parse(url, defaults));
  }

  static ConnectionSettings parse(String url, ConnectionSettings defaults) {
    try {
      URI uri = new URI(url);
      boolean tls = isTls(validateAndGetScheme(uri));
      validateHostPort(uri);

      ConnectionSettings settings = defaults.withHost(uri.getHost(), uri.getPort()).withTls(tls);
      String userInfo = uri.getRawUserInfo();
      if (userInfo != null) {
        int colon = userInfo.indexOf(':');
        String user = colon < 0 ? userInfo : userInfo.substring(0, colon);
        String password = colon < 0 ? "" : userInfo.substring(colon + 1);
        settings = settings.withCredentials(decode(user), decode(password));
      }
      logger.debug("Parsed {} as {}", uri.getHost() + ":" + uri.getPort(), settings);
      return settings;
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid URL format: " + url, e);
    }
  }

  private static String validateAndGetScheme(URI uri) {
    String scheme = uri.getScheme();
    if (scheme == null) {
      throw new IllegalArgumentException("URL scheme must be specified");
    }
    return scheme.toLowerCase();
  }

  private static boolean isTls(String scheme) {
    return switch (scheme) {
      case "kdb"  -> false;
      case "kdbs" -> true;
      default     -> throw new IllegalArgumentException(
        "Unsupported scheme: " + scheme + ". Supported schemes are: kdb, kdbs"
      );
    };
  }

  private static void validateHostPort(URI uri) {
    if (uri.getHost() == null || uri.getPort() == -1) {
      throw new IllegalArgumentException(
        "Invalid URL format. Expected: scheme://[user[:password]@]host:port, got: " + uri.getScheme() + "://" + uri.getHost());
    }
  }

  private static String decode(String s) {
    return URLDecoder.decode(s, StandardCharsets.UTF_8);
  }
}
