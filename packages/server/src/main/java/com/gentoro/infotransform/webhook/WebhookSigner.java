package com.gentoro.infotransform.webhook;

import com.gentoro.infotransform.exception.StateException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 over {@code "<timestamp>.<body>"}, rendered as {@code sha256=<lowercase hex>}.
 *
 * <p>Binding the timestamp into the signed text lets receivers reject replays by age.
 */
public final class WebhookSigner {
  static final String ALGORITHM = "HmacSHA256";
  public static final String PREFIX = "sha256=";

  private final byte[] secret;

  public WebhookSigner(String secret) {
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("Webhook secret must not be empty");
    }
    this.secret = secret.getBytes(StandardCharsets.UTF_8);
  }

  public String sign(long timestampSeconds, String body) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret, ALGORITHM));
      byte[] digest =
          mac.doFinal((timestampSeconds + "." + body).getBytes(StandardCharsets.UTF_8));
      StringBuilder sb = new StringBuilder(PREFIX);
      for (byte b : digest) sb.append(String.format("%02x", b));
      return sb.toString();
    } catch (GeneralSecurityException e) {
      throw new StateException("Unable to compute webhook signature", e);
    }
  }

  /** Constant-time comparison of a received signature header. */
  public boolean verify(long timestampSeconds, String body, String signatureHeader) {
    if (signatureHeader == null) return false;
    byte[] expected = sign(timestampSeconds, body).getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(expected, signatureHeader.getBytes(StandardCharsets.UTF_8));
  }
}
