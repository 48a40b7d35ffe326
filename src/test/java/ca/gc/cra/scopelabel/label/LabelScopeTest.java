package ca.gc.cra.scopelabel.label;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scopelabel.config.LabelingConfig;
import ca.gc.cra.scopelabel.validation.LabelValidationException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LabelScopeTest {
  private LabelingContext context;

  @BeforeEach
  void setUp() {
    context = new LabelingContext();
  }

  @Test
  void unresolvedScopeHasNoName() {
    LabelScope scope = context.scope("model");

    assertFalse(scope.isResolved());
    assertThrows(UnresolvedScopeException.class, scope::name);
    assertThrows(UnresolvedScopeException.class, scope::absoluteScope);
    assertThrows(UnresolvedScopeException.class, scope::nextLabel);
    assertEquals("label_scope(<unresolved: model>)", scope.toString());
  }

  @Test
  void constructionDoesNotTouchState() {
    context.scope("model");
    context.unnamedScope();

    assertTrue(context.contextStack().isEmpty(LabelScope.CONTEXT_KEY));
    assertEquals(0L, context.counters().current("model"));
  }

  @Test
  void invalidNamesRejected() {
    assertThrows(LabelValidationException.class, () -> context.scope(""));
    assertThrows(LabelValidationException.class, () -> context.scope("a/b"));
    assertThrows(NullPointerException.class, () -> context.scope(null));
    assertEquals("a_b", context.scope("a_b").basename().orElseThrow());
  }

  @Test
  void underscoreRejectedWhenConfigured() {
    LabelingContext strict = new LabelingContext(new LabelingConfig("global", "default", true, true));
    assertThrows(LabelValidationException.class, () -> strict.scope("a_b"));
    assertThrows(LabelValidationException.class, () -> strict.autoLabel("a_b"));
  }

  @Test
  void enterResolvesAndActivates() {
    LabelScope scope = context.scope("model");

    try (LabelScope.Activation activation = scope.enter()) {
      assertSame(scope, activation.scope());
      assertTrue(scope.isActivated());
      assertEquals("model", scope.name());
      assertEquals(List.of("model"), scope.path().orElseThrow());
      assertSame(scope, context.currentScope().orElseThrow());
      assertEquals("label_scope('model')", scope.toString());
    }

    assertFalse(scope.isActivated());
    assertTrue(scope.isResolved());
    assertTrue(context.currentScope().isEmpty());
  }

  @Test
  void nestedScopeExtendsParentPath() {
    try (LabelScope.Activation model = context.scope("model").enter();
        LabelScope.Activation cell = context.scope("cell").enter()) {
      assertEquals("model/cell", cell.scope().name());
      assertEquals(List.of(model.scope(), cell.scope()),
          context.contextStack().snapshot(LabelScope.CONTEXT_KEY));
    }
  }

  @Test
  void unnamedScopeTakesParentCounter() {
    try (LabelScope.Activation model = context.scope("model").enter()) {
      model.scope().nextLabel();
      try (LabelScope.Activation nested = context.unnamedScope().enter()) {
        assertEquals("model/2", nested.scope().name());
        assertEquals("2", nested.scope().basename().orElseThrow());
      }
    }
  }

  @Test
  void unnamedScopeWithoutParentFallsBackToGlobal() {
    try (LabelScope.Activation first = context.unnamedScope().enter()) {
      assertEquals("global/1", first.scope().name());
    }
    try (LabelScope.Activation second = context.unnamedScope().enter()) {
      assertEquals("global/2", second.scope().name());
    }
  }

  @Test
  void enteringResetsOwnCounter() {
    LabelScope scope = context.scope("loop");
    context.counters().next("loop");
    context.counters().next("loop");

    try (LabelScope.Activation activation = scope.enter()) {
      assertEquals("1", scope.nextLabel());
    }
  }

  @Test
  void reenteringSameInstanceRestartsNumbering() {
    LabelScope scope = context.scope("loop");
    for (int i = 0; i < 3; i++) {
      try (LabelScope.Activation activation = scope.enter()) {
        assertEquals("loop/1", context.autoLabel().toString());
        assertEquals("loop/2", context.autoLabel().toString());
      }
    }
  }

  @Test
  void resolvedPathIsNotRecomputed() {
    LabelScope scope = context.scope("cell");
    try (LabelScope.Activation activation = scope.enter()) {
      assertEquals("cell", scope.name());
    }
    try (LabelScope.Activation outer = context.scope("model").enter();
        LabelScope.Activation again = scope.enter()) {
      assertEquals("cell", again.scope().name());
    }
  }

  @Test
  void fromLabelIgnoresActiveParent() {
    LabelScope scope = LabelScope.fromLabel(context, Label.of(List.of("a", "b")));
    try (LabelScope.Activation outer = context.scope("outer").enter();
        LabelScope.Activation inner = scope.enter()) {
      assertEquals("a/b", inner.scope().name());
      assertEquals("a/b/1", context.autoLabel().toString());
    }
  }

  @Test
  void fromExistingScopeCopiesPath() {
    LabelScope original = context.scope("model");
    assertThrows(UnresolvedScopeException.class, () -> LabelScope.fromExistingScope(original));

    try (LabelScope.Activation activation = original.enter()) {
      LabelScope copy = LabelScope.fromExistingScope(original);
      assertEquals(original, copy);
      assertEquals(original.hashCode(), copy.hashCode());
      assertFalse(copy.isActivated());
      assertEquals("model", copy.name());
    }
  }

  @Test
  void equalityFollowsPath() {
    LabelScope a = context.scope("x");
    LabelScope b = context.scope("x");
    try (LabelScope.Activation first = a.enter()) {
      assertNotEquals(a, b);
    }
    try (LabelScope.Activation second = b.enter()) {
      assertEquals(a, b);
    }
    assertNotEquals(a, context.globalScope());
  }

  @Test
  void globalScopeIsPreResolved() {
    LabelScope global = context.globalScope();
    assertEquals("global", global.name());
    assertFalse(global.isActivated());
    assertEquals("1", global.nextLabel());
    assertEquals("2", context.globalScope().nextLabel());
  }

  @Test
  void configuredGlobalScopeName() {
    LabelingContext custom = new LabelingContext(new LabelingConfig("root", "default", false, false));
    assertEquals("root", custom.globalScope().name());
    assertEquals("root/1", custom.autoLabel().toString());
  }

  @Test
  void currentIsEmptyWithoutScope() {
    assertTrue(context.currentScope().isEmpty());
  }

  @Test
  void exceptionInsideBlockStillExits() {
    LabelScope scope = context.scope("model");

    assertThrows(IllegalArgumentException.class, () -> {
      try (LabelScope.Activation activation = scope.enter()) {
        throw new IllegalArgumentException("boom");
      }
    });

    assertFalse(scope.isActivated());
    assertTrue(context.currentScope().isEmpty());
  }

  @Test
  void outOfOrderExitFails() {
    LabelScope.Activation outer = context.scope("outer").enter();
    LabelScope.Activation inner = context.scope("inner").enter();

    assertThrows(IllegalStateException.class, outer::close);
    assertSame(inner.scope(), context.currentScope().orElseThrow());

    inner.close();
    outer.close();
    outer.close();
    assertTrue(context.currentScope().isEmpty());
  }
}
