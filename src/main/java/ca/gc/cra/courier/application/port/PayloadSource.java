package ca.gc.cra.courier.application.port;

import ca.gc.cra.courier.domain.payload.Payload;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Port supplying the payloads an origin submits during a run.
 * <p><strong>Role:</strong> Implemented by {@code SyntheticPayloadSource} and {@code DirectoryPayloadSource}.</p>
 *
 * @since 0.1.0
 */
public interface PayloadSource {
  /**
   * Loads every payload in submission order.
   *
   * @return payloads; tags are the submission indexes
   * @throws IOException if the backing store cannot be read
   */
  List<Payload> load() throws IOException;
}
