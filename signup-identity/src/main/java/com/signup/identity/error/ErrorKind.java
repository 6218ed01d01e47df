package com.signup.identity.error;

/** Why a registration ended. */
public enum ErrorKind {
  VALIDATION,
  CONFLICT,
  HASHING,
  ENTITY_CONSTRUCTION,
  PERSISTENCE,
  EVENT_PUBLICATION
}
