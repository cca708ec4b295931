package com.flamingo.ai.notebookrag.exception;

/** Thrown when a configuration names a provider the pipeline cannot dispatch to. */
public class UnsupportedProviderException extends ProviderException {

  public UnsupportedProviderException(String provider) {
    super(Reason.UNSUPPORTED_PROVIDER, provider, "Unsupported provider: " + provider);
  }
}
