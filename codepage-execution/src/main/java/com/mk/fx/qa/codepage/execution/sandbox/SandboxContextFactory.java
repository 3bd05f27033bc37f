package com.mk.fx.qa.codepage.execution.sandbox;

import com.mk.fx.qa.codepage.execution.model.ErrorKind;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;

/**
 * Creates interpreter contexts that can neither see host classes nor outrun their deadline.
 *
 * <p>Scripts run interpreted so the instruction observer fires every {@code
 * instructionObserverThreshold} instructions; the observer consults the {@link ResourceMonitor}
 * stored as a context thread-local and unwinds the script with {@link SandboxAbortError} once the
 * run has been abandoned.
 */
class SandboxContextFactory extends ContextFactory {

  private final int instructionObserverThreshold;
  private final int maxStackDepth;

  SandboxContextFactory(int instructionObserverThreshold, int maxStackDepth) {
    this.instructionObserverThreshold = instructionObserverThreshold;
    this.maxStackDepth = maxStackDepth;
  }

  @Override
  protected Context makeContext() {
    Context cx = super.makeContext();
    cx.setLanguageVersion(Context.VERSION_ES6);
    cx.setOptimizationLevel(-1);
    cx.setInstructionObserverThreshold(instructionObserverThreshold);
    cx.setMaximumInterpreterStackDepth(maxStackDepth);
    cx.setClassShutter(className -> false);
    cx.setGeneratingDebug(false);
    return cx;
  }

  @Override
  protected boolean hasFeature(Context cx, int featureIndex) {
    if (featureIndex == Context.FEATURE_ENHANCED_JAVA_ACCESS) {
      return false;
    }
    return super.hasFeature(cx, featureIndex);
  }

  @Override
  protected void observeInstructionCount(Context cx, int instructionCount) {
    if (cx.getThreadLocal(ResourceMonitor.class) instanceof ResourceMonitor monitor
        && !monitor.checkDeadline()) {
      throw new SandboxAbortError(monitor.violation().orElse(ErrorKind.EXECUTION_CANCELLED));
    }
    if (Thread.currentThread().isInterrupted()) {
      throw new SandboxAbortError(ErrorKind.EXECUTION_CANCELLED);
    }
  }
}
