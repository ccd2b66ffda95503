package com.gentoro.optiflow.exception;

/** Stable error kinds reported by the engine, its loader and its persistence layer. */
public enum OptiFlowErrorCode {
  /** Malformed workflow definition: duplicate id, dangling target, missing field. */
  DEFINITION_ERROR,
  /** A template referenced a variable that has no entry in the mapping. */
  UNRESOLVED_VARIABLE,
  /** A store path could not be parsed or its destination could not be constructed. */
  PATH_ERROR,
  /** The external work unit raised or returned an incomplete payload. */
  CAPABILITY_ERROR,
  /** A branch condition is malformed or could not be evaluated. */
  CONDITION_ERROR,
  /** The store document could not be read or written. */
  STORE_ERROR,
  CONFIGURATION_ERROR,
  UNKNOWN
}
