package com.mk.fx.qa.codepage.execution.sandbox;

import org.mozilla.javascript.BaseFunction;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ScriptRuntime;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;

/** A script-callable function backed by Java code. Cannot be used as a constructor. */
final class HostFunction extends BaseFunction {

  @FunctionalInterface
  interface Body {
    Object apply(Context cx, Scriptable scope, Object[] args);
  }

  private final String name;
  private final int arity;
  private final transient Body body;

  HostFunction(Scriptable scope, String name, int arity, Body body) {
    super(scope, ScriptableObject.getFunctionPrototype(scope));
    this.name = name;
    this.arity = arity;
    this.body = body;
  }

  @Override
  public Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
    return body.apply(cx, scope, args);
  }

  @Override
  public Scriptable construct(Context cx, Scriptable scope, Object[] args) {
    throw ScriptRuntime.typeError(name + " is not a constructor");
  }

  @Override
  public String getFunctionName() {
    return name;
  }

  @Override
  public int getArity() {
    return arity;
  }

  @Override
  public int getLength() {
    return arity;
  }
}
