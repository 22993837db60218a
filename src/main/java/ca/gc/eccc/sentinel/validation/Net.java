package ca.gc.eccc.sentinel.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates Kafka bootstrap endpoints ({@code HOST:PORT}, comma-separated).
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a comma-separated bootstrap server list.
   *
   * @param name key used in error messages
   * @param value list such as {@code broker1:9092,broker2:9092}
   * @return normalized list joined with commas
   */
  public static String validateBootstrapServers(String name, String value) {
    List<String> endpoints = Strings.splitList(name, value);
    if (endpoints.isEmpty()) {
      throw new IllegalArgumentException(name + " must list at least one HOST:PORT");
    }
    List<String> normalized = new ArrayList<>(endpoints.size());
    for (String endpoint : endpoints) {
      try {
        normalized.add(validateHostPort(endpoint));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(name + ": " + ex.getMessage(), ex);
      }
    }
    return String.join(",", normalized);
  }

  /**
   * Validates one {@code HOST:PORT} endpoint; IPv6 hosts must be bracketed.
   *
   * @param value endpoint text
   * @return normalized endpoint
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int close = sanitized.indexOf(']');
      if (close < 0 || close + 2 > sanitized.length() || sanitized.charAt(close + 1) != ':') {
        throw new IllegalArgumentException("host:port must use [IPv6]:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(1, close);
      portPart = sanitized.substring(close + 2);
      requireIpv6(host);
      host = '[' + host + ']';
    } else {
      int colon = sanitized.lastIndexOf(':');
      if (colon <= 0 || colon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, colon);
      portPart = sanitized.substring(colon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      if (IPV4_PATTERN.matcher(host).matches()) {
        for (String octet : host.split("\\.")) {
          Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
        }
      } else {
        requireHostname(host);
      }
    }
    long port = Numbers.parseLong("port", portPart, 1, 65535);
    return host + ':' + port;
  }

  private static void requireHostname(String host) {
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("hostname longer than " + MAX_HOSTNAME_LENGTH + " characters");
    }
    for (String label : host.split("\\.", -1)) {
      if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
        throw new IllegalArgumentException("invalid hostname label in " + host);
      }
      if (!isAsciiAlnum(label.charAt(0)) || !isAsciiAlnum(label.charAt(label.length() - 1))) {
        throw new IllegalArgumentException("hostname labels must start and end with a letter or digit: " + host);
      }
      for (int i = 1; i < label.length() - 1; i++) {
        char c = label.charAt(i);
        if (!isAsciiAlnum(c) && c != '-') {
          throw new IllegalArgumentException("invalid hostname character '" + c + "' in " + host);
        }
      }
    }
  }

  private static void requireIpv6(String host) {
    try {
      if (!(InetAddress.getByName(host) instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
