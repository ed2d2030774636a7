package com.wccms.db;

import com.wccms.common.status.Status;
import com.wccms.common.status.StatusOr;
import java.time.Instant;
import java.util.Optional;

/** Account lookups used by authentication and the authorization gates. */
public interface UserDirectory {

  StatusOr<Optional<User>> findById(String id);

  StatusOr<Optional<User>> findByUsername(String username);

  StatusOr<Optional<User>> findByEmail(String email);

  /** Inserts or updates an account. */
  Status save(User user);

  Status updateLastLogin(String id, Instant at);
}
