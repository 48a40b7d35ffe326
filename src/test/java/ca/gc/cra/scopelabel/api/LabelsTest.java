package ca.gc.cra.scopelabel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scopelabel.context.ContextStack;
import ca.gc.cra.scopelabel.context.NoContextException;
import ca.gc.cra.scopelabel.label.Label;
import ca.gc.cra.scopelabel.label.LabelScope;
import ca.gc.cra.scopelabel.label.LabelingContext;
import ca.gc.cra.scopelabel.validation.LabelValidationException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LabelsTest {

  @BeforeEach
  void setUp() {
    LabelingContext.setDefault(new LabelingContext());
  }

  @AfterEach
  void tearDown() {
    LabelingContext.getDefault().reset();
    LabelingContext.setDefault(null);
  }

  @Test
  void uidUsesDefaultNamespace() {
    assertEquals(1L, Labels.uid());
    assertEquals(2L, Labels.uid());
    assertEquals(1L, Labels.uid("other"));

    Labels.resetUid();
    assertEquals(1L, Labels.uid());
    assertEquals(2L, LabelingContext.getDefault().counters().next("default"));

    Labels.resetUid("other");
    assertEquals(1L, Labels.uid("other"));
  }

  @Test
  void scopeCountsThenNames() {
    try (LabelScope.Activation model = Labels.scope("model").enter()) {
      assertEquals("model/1", Labels.autoLabel().toString());
      assertEquals("model/2", Labels.autoLabel().toString());
      assertEquals("model/foo", Labels.autoLabel("foo").toString());

      try (LabelScope.Activation nested = Labels.scope().enter()) {
        assertEquals("model/3/1", Labels.autoLabel().toString());
        assertEquals("model/3/2", Labels.autoLabel().toString());
      }
    }
  }

  @Test
  void reenteredScopeStartsOver() {
    try (LabelScope.Activation model = Labels.scope("model").enter()) {
      Labels.autoLabel();
      Labels.autoLabel();
    }
    try (LabelScope.Activation model = Labels.scope("model").enter()) {
      assertEquals("model/1", Labels.autoLabel().toString());
    }
  }

  @Test
  void noScopeUsesGlobalNumbering() {
    assertEquals("global/1", Labels.autoLabel().toString());
    assertEquals("global/2", Labels.autoLabel().toString());
  }

  @Test
  void autoLabelIsIdempotent() {
    Label once = Labels.autoLabel("bar");
    Label twice = Labels.autoLabel(Labels.autoLabel("bar"));

    assertEquals(once, twice);
    assertTrue(twice.contentEquals("bar"));
  }

  @Test
  void invalidNamesFail() {
    assertThrows(LabelValidationException.class, () -> Labels.scope("a/b"));
    assertThrows(LabelValidationException.class, () -> Labels.autoLabel("a/b"));
    assertThrows(LabelValidationException.class, () -> Labels.scope(""));
  }

  @Test
  void currentAndGlobal() {
    assertTrue(Labels.current().isEmpty());
    try (LabelScope.Activation model = Labels.scope("model").enter()) {
      assertSame(model.scope(), Labels.current().orElseThrow());
      assertSame(model.scope(), Labels.currentContext(LabelScope.CONTEXT_KEY));
    }
    assertEquals("global", Labels.global().name());
  }

  @Test
  void contextStackIsSharedForArbitraryKeys() {
    ContextStack stack = Labels.contextStack();
    assertThrows(NoContextException.class, () -> Labels.currentContext("tenant"));
    try (ContextStack.Frame frame = stack.enter("tenant", "acme")) {
      assertEquals("acme", Labels.currentContext("tenant"));
    }
    assertTrue(stack.isEmpty("tenant"));
  }

  @Test
  void labelFactoriesAndConversion() {
    Label label = Labels.label(List.of("model", "cell", "2"));
    assertEquals("model/cell/2", label.toString());
    assertEquals(Labels.label("model/cell/2"), label);

    LabelScope scope = label.asScope();
    try (LabelScope.Activation activation = scope.enter()) {
      assertEquals("model/cell/2/1", Labels.autoLabel().toString());
      assertEquals("model/cell/2/x", Labels.autoLabel("x", scope).toString());
    }
  }
}
