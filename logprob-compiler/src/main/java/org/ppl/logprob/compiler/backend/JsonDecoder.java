/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 *
 *
 */

package org.ppl.logprob.compiler.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ppl.logprob.compiler.errors.CompilationError;
import org.ppl.logprob.ir.Constant;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.BroadcastToOp;
import org.ppl.logprob.ir.op.DimShuffleOp;
import org.ppl.logprob.ir.op.DiracDeltaOp;
import org.ppl.logprob.ir.op.Distributions;
import org.ppl.logprob.ir.op.ElemwiseOp;
import org.ppl.logprob.ir.op.IncSubtensorOp;
import org.ppl.logprob.ir.op.IndexEntry;
import org.ppl.logprob.ir.op.Op;
import org.ppl.logprob.ir.op.OpKind;
import org.ppl.logprob.ir.op.ScalarOpcode;
import org.ppl.logprob.ir.op.SubtensorOp;
import org.ppl.logprob.ir.type.DType;
import org.ppl.logprob.ir.type.TensorType;
import org.ppl.logprob.ir.value.NDArray;
import org.ppl.util.IWritesLogs;
import org.ppl.util.Logger;
import org.ppl.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a model from JSON.  The format is:
 * <pre>
 * {
 *   "variables": [
 *     { "id": 0, "name": "mu", "type": { "dtype": "float64", "shape": [] } },
 *     { "id": 1, "value": { "dtype": "float64", "shape": [2], "data": [1, 2] } },
 *     { "id": 2, "name": "X", "op": { "kind": "random_variable", "distribution": "normal", "size": [2] },
 *       "inputs": [0, 1] }
 *   ],
 *   "bindings": [ { "rv": 2, "value": 3 } ]
 * }
 * </pre>
 * A variable can only use variables which appear before it.
 */
public class JsonDecoder implements IWritesLogs {
    /** A model read from JSON. */
    public record Model(Map<Long, Variable> variables, Map<Variable, Variable> bindings) {
        public Variable getVariable(long id) {
            Variable result = this.variables.get(id);
            if (result == null)
                throw new CompilationError("Variable with id " + id + " not defined");
            return result;
        }
    }

    final Map<Long, Variable> decoded;

    public JsonDecoder() {
        this.decoded = new LinkedHashMap<>();
    }

    public static Model decode(String json) {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        try {
            JsonNode node = mapper.readTree(json);
            return new JsonDecoder().decode(node);
        } catch (JsonProcessingException ex) {
            throw new CompilationError("Could not parse JSON model: " + ex.getMessage(), ex);
        }
    }

    Variable lookup(long id) {
        Variable result = this.decoded.get(id);
        if (result == null)
            throw new CompilationError("Variable with id " + id + " used before being defined");
        return result;
    }

    static List<Integer> getShape(JsonNode node, String property) {
        JsonNode shape = Utilities.getProperty(node, property);
        if (!shape.isArray())
            throw new CompilationError("Property " + Utilities.singleQuote(property) + " is not an array: " + node);
        List<Integer> result = new ArrayList<>();
        for (JsonNode dim: shape)
            result.add(dim.asInt());
        return result;
    }

    static TensorType decodeType(JsonNode node) {
        DType dtype = DType.fromName(Utilities.getStringProperty(node, "dtype"));
        return new TensorType(dtype, getShape(node, "shape"));
    }

    static NDArray decodeValue(JsonNode node) {
        List<Integer> shape = getShape(node, "shape");
        JsonNode data = Utilities.getProperty(node, "data");
        double[] values = new double[data.size()];
        for (int i = 0; i < values.length; i++)
            values[i] = data.get(i).asDouble();
        return new NDArray(shape, values);
    }

    static IndexEntry decodeIndex(JsonNode node) {
        if (node.has("at"))
            return IndexEntry.at(Utilities.getIntProperty(node, "at"));
        if (node.has("array")) {
            JsonNode array = node.get("array");
            int[] positions = new int[array.size()];
            for (int i = 0; i < positions.length; i++)
                positions[i] = array.get(i).asInt();
            return IndexEntry.array(positions);
        }
        if (node.has("slice")) {
            JsonNode slice = node.get("slice");
            return IndexEntry.slice(optionalInt(slice, "start"), optionalInt(slice, "stop"), optionalInt(slice, "step"));
        }
        throw new CompilationError("Unknown index " + node);
    }

    @Nullable
    static Integer optionalInt(JsonNode node, String property) {
        JsonNode value = node.get(property);
        if (value == null || value.isNull())
            return null;
        return value.asInt();
    }

    static List<IndexEntry> decodeIndices(JsonNode node) {
        List<IndexEntry> result = new ArrayList<>();
        for (JsonNode index: Utilities.getProperty(node, "indices"))
            result.add(decodeIndex(index));
        return result;
    }

    static Op decodeOp(JsonNode node) {
        String kindName = Utilities.getStringProperty(node, "kind");
        OpKind kind;
        try {
            kind = OpKind.valueOf(kindName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new CompilationError("Unknown operation kind " + Utilities.singleQuote(kindName), ex);
        }
        switch (kind) {
            case RANDOM_VARIABLE: {
                List<Integer> size = node.hasNonNull("size") ? getShape(node, "size") : null;
                return Distributions.fromName(Utilities.getStringProperty(node, "distribution"), size);
            }
            case ELEMWISE:
                return new ElemwiseOp(ScalarOpcode.fromName(Utilities.getStringProperty(node, "opcode")));
            case DIMSHUFFLE:
                return new DimShuffleOp(getShape(node, "order"));
            case BROADCAST_TO:
                return new BroadcastToOp(getShape(node, "shape"));
            case SUBTENSOR:
                return new SubtensorOp(decodeIndices(node));
            case INC_SUBTENSOR:
                return new IncSubtensorOp(decodeIndices(node), Utilities.getProperty(node, "set").asBoolean());
            case DIRAC_DELTA:
                return DiracDeltaOp.INSTANCE;
            default:
                throw new CompilationError("Unsupported operation kind " + kind);
        }
    }

    Variable decodeVariable(JsonNode node) {
        long id = Utilities.getLongProperty(node, "id");
        String name = node.hasNonNull("name") ? node.get("name").asText() : null;
        Variable result;
        if (node.has("value")) {
            TensorType type = decodeType(node.get("value"));
            result = new Constant(type.dtype, decodeValue(node.get("value")), name);
        } else if (node.has("op")) {
            Op op = decodeOp(node.get("op"));
            List<Variable> inputs = new ArrayList<>();
            for (JsonNode input: Utilities.getProperty(node, "inputs"))
                inputs.add(this.lookup(input.asLong()));
            result = op.makeNode(inputs).output();
            result.setName(name);
        } else {
            result = new Variable(decodeType(Utilities.getProperty(node, "type")), name);
        }
        if (this.decoded.containsKey(id))
            throw new CompilationError("Variable id " + id + " defined twice");
        this.decoded.put(id, result);
        return result;
    }

    public Model decode(JsonNode node) {
        for (JsonNode variable: Utilities.getProperty(node, "variables"))
            this.decodeVariable(variable);
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        JsonNode bindingList = node.get("bindings");
        if (bindingList != null) {
            for (JsonNode binding: bindingList) {
                Variable rv = this.lookup(Utilities.getLongProperty(binding, "rv"));
                Variable value = this.lookup(Utilities.getLongProperty(binding, "value"));
                if (!rv.type.sameType(value.type))
                    throw new CompilationError("Variable " + rv + " of type " + rv.type +
                            " bound to " + value + " of type " + value.type);
                if (bindings.put(rv, value) != null)
                    throw new CompilationError("Variable " + rv + " bound twice");
            }
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Decoded ")
                .append(this.decoded.size())
                .append(" variables and ")
                .append(bindings.size())
                .append(" bindings")
                .newline();
        return new Model(new HashMap<>(this.decoded), bindings);
    }
}
