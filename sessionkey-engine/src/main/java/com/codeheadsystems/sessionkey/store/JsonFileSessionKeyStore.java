package com.codeheadsystems.sessionkey.store;

import com.codeheadsystems.sessionkey.model.SessionKeyState;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionKeyStore} that keeps every session key in a single JSON document so that
 * revocations and ledgers survive a restart.
 * <p>
 * Entries live in an {@link InMemorySessionKeyStore}, which provides the per-key atomic update.
 * After every mutation of persisted fields the whole document is rewritten to a temporary file and moved over the
 * previous one, so a crash leaves either the old or the new document on disk. Writes are
 * serialized and always snapshot the current map, so the last write reflects every completed
 * mutation.
 * <p>
 * Key material is never written: identities carry only address, public key and custody handle.
 * Suitable for a single process; there is no cross-process locking.
 */
public class JsonFileSessionKeyStore implements SessionKeyStore {

  private static final Logger log = LoggerFactory.getLogger(JsonFileSessionKeyStore.class);

  /**
   * Current document format version.
   */
  static final int FORMAT_VERSION = 1;

  private final Path file;
  private final ObjectMapper objectMapper;
  private final InMemorySessionKeyStore delegate = new InMemorySessionKeyStore();
  private final Object writeLock = new Object();

  /**
   * Opens the store, loading the document at {@code file} if it exists.
   *
   * @param file the JSON document
   * @throws UncheckedIOException     if an existing document cannot be read
   * @throws IllegalStateException    if the document was written by an unknown format version
   */
  public JsonFileSessionKeyStore(Path file) {
    this(file, ObjectMappers.sessionKeyMapper());
  }

  /**
   * Instantiates a new Json file session key store.
   *
   * @param file         the file
   * @param objectMapper the object mapper
   */
  public JsonFileSessionKeyStore(Path file, ObjectMapper objectMapper) {
    this.file = file;
    this.objectMapper = objectMapper;
    load();
  }

  private void load() {
    if (!Files.exists(file)) {
      log.info("No session key document at {}; starting empty", file);
      return;
    }
    try {
      PersistedSessionKey.Document document =
          objectMapper.readValue(file.toFile(), PersistedSessionKey.Document.class);
      if (document.version() != FORMAT_VERSION) {
        throw new IllegalStateException("Unsupported session key document version "
            + document.version() + " in " + file);
      }
      List<PersistedSessionKey> keys = document.keys() == null ? List.of() : document.keys();
      keys.forEach(key -> delegate.store(key.toState()));
      log.info("Loaded {} session key(s) from {}", keys.size(), file);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read session key document " + file, e);
    }
  }

  @Override
  public void store(SessionKeyState state) {
    delegate.store(state);
    persist();
  }

  @Override
  public Optional<SessionKeyState> load(String id) {
    return delegate.load(id);
  }

  @Override
  public List<SessionKeyState> loadAll() {
    return delegate.loadAll();
  }

  @Override
  public Optional<SessionKeyState> update(String id, UnaryOperator<SessionKeyState> mutation) {
    boolean[] changed = {false};
    Optional<SessionKeyState> result = delegate.update(id, current -> {
      SessionKeyState next = mutation.apply(current);
      // Reservations are not written, so reserve and release leave the document alone.
      changed[0] = next != current && !PersistedSessionKey.from(next).equals(PersistedSessionKey.from(current));
      return next;
    });
    if (changed[0]) {
      persist();
    }
    return result;
  }

  private void persist() {
    synchronized (writeLock) {
      List<PersistedSessionKey> keys = delegate.loadAll().stream()
          .sorted(Comparator.comparing(SessionKeyState::id))
          .map(PersistedSessionKey::from)
          .toList();
      Path temp = file.resolveSibling(file.getFileName() + ".tmp");
      try {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        objectMapper.writeValue(temp.toFile(), new PersistedSessionKey.Document(FORMAT_VERSION, keys));
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Persisted {} session key(s) to {}", keys.size(), file);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to write session key document " + file, e);
      }
    }
  }
}
