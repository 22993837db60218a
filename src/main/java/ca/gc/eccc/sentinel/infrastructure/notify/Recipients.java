package ca.gc.eccc.sentinel.infrastructure.notify;

import ca.gc.eccc.sentinel.application.port.DeliveryException;
import java.util.List;

/**
 * Recipient address checks shared by notifiers. A malformed recipient is a terminal delivery failure.
 *
 * @since 0.1.0
 */
public final class Recipients {
  private Recipients() {}

  /**
   * Rejects recipients that cannot be addressed.
   *
   * @param recipients recipient addresses
   * @throws DeliveryException terminal {@code malformed-recipient} failure
   */
  public static void requireAddressable(List<String> recipients) throws DeliveryException {
    for (String recipient : recipients) {
      if (!isAddressable(recipient)) {
        throw DeliveryException.terminal("malformed-recipient", "malformed recipient: " + recipient);
      }
    }
  }

  static boolean isAddressable(String recipient) {
    if (recipient == null || recipient.isBlank()) {
      return false;
    }
    for (int i = 0; i < recipient.length(); i++) {
      char c = recipient.charAt(i);
      if (Character.isWhitespace(c) || Character.isISOControl(c) || c == ',' || c == ';') {
        return false;
      }
    }
    int at = recipient.indexOf('@');
    return at < 0 || (at > 0 && at == recipient.lastIndexOf('@') && at < recipient.length() - 1);
  }
}
