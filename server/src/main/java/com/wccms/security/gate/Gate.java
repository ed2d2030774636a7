package com.wccms.security.gate;

import java.util.function.Function;

/** One authorization decision applied to a request before its handler runs. */
public interface Gate {

  Stage stage();

  /** Short name used in logs. */
  String name();

  GateResult check(RequestContext ctx);

  static Gate of(Stage stage, String name, Function<RequestContext, GateResult> check) {
    return new Gate() {
      @Override
      public Stage stage() {
        return stage;
      }

      @Override
      public String name() {
        return name;
      }

      @Override
      public GateResult check(RequestContext ctx) {
        return check.apply(ctx);
      }

      @Override
      public String toString() {
        return name + "@" + stage;
      }
    };
  }
}
