package com.gentoro.usml.exception;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  @DisplayName("USML exceptions keep their code, message and context")
  void usmlDetails() {
    UsmlException e =
        new ResolutionException("Cannot resolve ./s.dbml#tables[\"x\"]")
            .withContext("reference", "./s.dbml#tables[\"x\"]")
            .withContext("ignored", null);

    ErrorDetails details = ExceptionUtil.toErrorDetails(e);
    assertEquals("ResolutionException", details.type());
    assertEquals(UsmlErrorCode.RESOLUTION_ERROR, details.code());
    assertEquals(1, details.context().size());
    assertNotNull(details.at());
    assertEquals("Cannot resolve ./s.dbml#tables[\"x\"]", ExceptionUtil.extractErrorMessage(e));
  }

  @Test
  @DisplayName("foreign exceptions are unknown and described by the first message in the chain")
  void foreignDetails() {
    RuntimeException wrapped = new RuntimeException(null, new IllegalArgumentException(" bad input "));

    assertEquals(UsmlErrorCode.UNKNOWN, ExceptionUtil.codeOf(wrapped));
    assertEquals(UsmlErrorCode.UNKNOWN, ExceptionUtil.toErrorDetails(wrapped).code());
    assertEquals("IllegalArgumentException: bad input", ExceptionUtil.extractErrorMessage(wrapped));
    assertEquals("IllegalStateException", ExceptionUtil.extractErrorMessage(new IllegalStateException()));
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
  }

  @Test
  @DisplayName("parse exceptions prefix their location")
  void parseLocation() {
    DocumentParseException located = new DocumentParseException("must not be blank", "usecase.name");
    assertEquals("usecase.name: must not be blank", located.getMessage());
    assertTrue(located.hasLocation());
    assertEquals("usecase.name", located.getContext().get("location"));

    DocumentParseException bare = new DocumentParseException("USML document is empty");
    assertFalse(bare.hasLocation());
    assertTrue(bare.getContext().isEmpty());
  }
}
