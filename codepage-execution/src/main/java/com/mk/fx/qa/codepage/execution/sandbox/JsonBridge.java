package com.mk.fx.qa.codepage.execution.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.EcmaError;
import org.mozilla.javascript.NativeJSON;
import org.mozilla.javascript.ScriptRuntime;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.Undefined;
import org.mozilla.javascript.json.JsonParser;

/**
 * Moves values across the sandbox boundary as JSON, so scripts only ever receive plain data and
 * host code never holds references into the script heap.
 */
final class JsonBridge {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  JsonBridge(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /** Converts a script object argument; {@code undefined} and {@code null} become an empty map. */
  Map<String, Object> toJavaMap(Context cx, Scriptable scope, Object value) {
    var json = stringify(cx, scope, value);
    if (json == null) {
      return new LinkedHashMap<>();
    }
    try {
      var node = mapper.readTree(json);
      if (!node.isObject()) {
        throw ScriptRuntime.typeError("Expected an object but got " + ScriptRuntime.typeof(value));
      }
      return mapper.convertValue(node, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw ScriptRuntime.typeError("Argument is not serialisable: " + e.getOriginalMessage());
    }
  }

  Object toScript(Context cx, Scriptable scope, Object value) {
    if (value == null) {
      return null;
    }
    try {
      return new JsonParser(cx, scope).parseValue(mapper.writeValueAsString(value));
    } catch (JsonProcessingException | JsonParser.ParseException e) {
      throw new IllegalStateException("Cannot expose value to script", e);
    }
  }

  /** Renders one console argument: objects as JSON, errors and primitives as their string form. */
  String render(Context cx, Scriptable scope, Object arg) {
    if (arg instanceof CharSequence) {
      return arg.toString();
    }
    if (arg instanceof Scriptable obj && !"Error".equals(obj.getClassName())) {
      try {
        var json = stringify(cx, scope, obj);
        return json != null ? json : Context.toString(arg);
      } catch (EcmaError circular) {
        return Context.toString(arg);
      }
    }
    return Context.toString(arg);
  }

  private static String stringify(Context cx, Scriptable scope, Object value) {
    if (value == null || Undefined.isUndefined(value)) {
      return null;
    }
    var json = NativeJSON.stringify(cx, scope, value, null, null);
    return Undefined.isUndefined(json) ? null : json.toString();
  }
}
