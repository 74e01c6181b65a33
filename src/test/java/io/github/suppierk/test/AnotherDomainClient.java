package io.github.suppierk.test;

import io.github.suppierk.es.authorization.DomainClient;
import java.io.Serial;

/** A client with a non-default role, used to exercise authorization refusals. */
public final class AnotherDomainClient implements DomainClient {
  @Serial private static final long serialVersionUID = -2914859398443221507L;

  public static final String ROLE = "OTHER";

  private AnotherDomainClient() {
    // No instance
  }

  public static AnotherDomainClient getInstance() {
    return Holder.INSTANCE;
  }

  @Override
  public String domainRole() {
    return ROLE;
  }

  private static class Holder {
    private static final AnotherDomainClient INSTANCE = new AnotherDomainClient();
  }
}
