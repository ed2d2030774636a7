package com.wccms.security.gate;

import com.wccms.security.IdentityClaim;
import java.util.Optional;
import javax.annotation.Nullable;

/** The parts of an inbound request that gates read, plus the identity slot they fill in. */
public interface RequestContext {

  /** Upper-case HTTP method. */
  String method();

  String path();

  /** Header value by case-insensitive name, or null. */
  @Nullable
  String header(String name);

  /** Path parameter value, or null when the route declares no such parameter. */
  @Nullable
  String pathParam(String name);

  Optional<IdentityClaim> identity();

  void setIdentity(IdentityClaim claim);
}
