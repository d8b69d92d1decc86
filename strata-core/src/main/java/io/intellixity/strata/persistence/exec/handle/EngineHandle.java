package io.intellixity.strata.persistence.exec.handle;

/**
 * What a partition name resolves to at run time: the store client a save or resolver query runs against.\n
 *
 * Handles are supplied per partition by the application; engines never open or close the client itself.
 */
public interface EngineHandle<C> {
  /** Stable label for logs and error messages. */
  String id();

  C client();

  /** Schema or database the dialect prefixes table names with; null keeps them unqualified. */
  String namespace();
}
