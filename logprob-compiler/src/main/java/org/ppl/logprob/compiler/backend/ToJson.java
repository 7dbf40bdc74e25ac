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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ppl.logprob.compiler.errors.InternalCompilerError;
import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.Constant;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.BroadcastToOp;
import org.ppl.logprob.ir.op.DimShuffleOp;
import org.ppl.logprob.ir.op.ElemwiseOp;
import org.ppl.logprob.ir.op.IncSubtensorOp;
import org.ppl.logprob.ir.op.IndexEntry;
import org.ppl.logprob.ir.op.Op;
import org.ppl.logprob.ir.op.RandomVariableOp;
import org.ppl.logprob.ir.op.SubtensorOp;
import org.ppl.logprob.ir.type.TensorType;
import org.ppl.logprob.ir.value.NDArray;
import org.ppl.util.Utilities;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Writes a graph and its bindings in the format read by {@link JsonDecoder}.
 * Variables are numbered in the order they are written. */
public class ToJson {
    final ObjectMapper mapper;
    final ArrayNode variables;
    final Map<Variable, Long> ids;

    public ToJson() {
        this.mapper = Utilities.deterministicObjectMapper();
        this.variables = this.mapper.createArrayNode();
        this.ids = new HashMap<>();
    }

    ObjectNode encodeType(TensorType type) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("dtype", type.dtype.name);
        ArrayNode shape = result.putArray("shape");
        type.shape.forEach(shape::add);
        return result;
    }

    ObjectNode encodeValue(Constant constant) {
        ObjectNode result = this.encodeType(constant.type);
        ArrayNode data = result.putArray("data");
        NDArray value = constant.value;
        for (int i = 0; i < value.size(); i++)
            data.add(value.get(i));
        return result;
    }

    void encodeIndices(ObjectNode op, List<IndexEntry> indices) {
        ArrayNode array = op.putArray("indices");
        for (IndexEntry entry: indices) {
            ObjectNode index = array.addObject();
            if (entry instanceof IndexEntry.Scalar) {
                index.put("at", ((IndexEntry.Scalar) entry).position);
            } else if (entry instanceof IndexEntry.Array) {
                ArrayNode positions = index.putArray("array");
                for (int position: ((IndexEntry.Array) entry).getPositions())
                    positions.add(position);
            } else {
                IndexEntry.Slice slice = (IndexEntry.Slice) entry;
                ObjectNode object = index.putObject("slice");
                if (slice.start != null)
                    object.put("start", slice.start);
                if (slice.stop != null)
                    object.put("stop", slice.stop);
                if (slice.step != null)
                    object.put("step", slice.step);
            }
        }
    }

    ObjectNode encodeOp(Op op) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("kind", op.kind().name().toLowerCase(Locale.ROOT));
        switch (op.kind()) {
            case RANDOM_VARIABLE: {
                RandomVariableOp rv = op.to(RandomVariableOp.class);
                result.put("distribution", rv.distribution);
                if (rv.size != null) {
                    ArrayNode size = result.putArray("size");
                    rv.size.forEach(size::add);
                }
                break;
            }
            case ELEMWISE:
                result.put("opcode", op.to(ElemwiseOp.class).opcode.name);
                break;
            case DIMSHUFFLE: {
                ArrayNode order = result.putArray("order");
                op.to(DimShuffleOp.class).newOrder.forEach(order::add);
                break;
            }
            case BROADCAST_TO: {
                ArrayNode shape = result.putArray("shape");
                op.to(BroadcastToOp.class).shape.forEach(shape::add);
                break;
            }
            case SUBTENSOR:
                this.encodeIndices(result, op.to(SubtensorOp.class).indices);
                break;
            case INC_SUBTENSOR: {
                IncSubtensorOp inc = op.to(IncSubtensorOp.class);
                this.encodeIndices(result, inc.indices);
                result.put("set", inc.setInstead);
                break;
            }
            case DIRAC_DELTA:
                break;
            default:
                throw new InternalCompilerError("Cannot encode operation " + op);
        }
        return result;
    }

    /** Write 'variable' and the variables it depends on; return its id. */
    long encode(Variable variable) {
        Long id = this.ids.get(variable);
        if (id != null)
            return id;
        Apply node = variable.owner;
        if (node != null) {
            Utilities.enforce(node.getOutputs().size() == 1, () -> "Cannot encode multi-output node " + node);
            for (Variable input: node.getInputs())
                this.encode(input);
        }
        long result = this.ids.size();
        ObjectNode object = this.variables.addObject();
        object.put("id", result);
        if (variable.getName() != null)
            object.put("name", variable.getName());
        if (variable instanceof Constant) {
            object.set("value", this.encodeValue((Constant) variable));
        } else if (node != null) {
            object.set("op", this.encodeOp(node.op));
            ArrayNode inputs = object.putArray("inputs");
            for (Variable input: node.getInputs())
                inputs.add(this.ids.get(input));
        } else {
            object.set("type", this.encodeType(variable.type));
        }
        this.ids.put(variable, result);
        return result;
    }

    /** Encode a graph with its bindings. */
    public ObjectNode toJson(FunctionGraph graph, Map<Variable, Variable> bindings) {
        ObjectNode result = this.mapper.createObjectNode();
        ArrayNode outputs = this.mapper.createArrayNode();
        for (Variable output: graph.getOutputs())
            outputs.add(this.encode(output));
        ArrayNode encodedBindings = this.mapper.createArrayNode();
        for (Map.Entry<Variable, Variable> entry: bindings.entrySet()) {
            ObjectNode binding = encodedBindings.addObject();
            binding.put("rv", this.encode(entry.getKey()));
            binding.put("value", this.encode(entry.getValue()));
        }
        result.set("variables", this.variables);
        result.set("outputs", outputs);
        result.set("bindings", encodedBindings);
        return result;
    }

    public static String toJsonString(FunctionGraph graph, Map<Variable, Variable> bindings) {
        ToJson encoder = new ToJson();
        ObjectNode node = encoder.toJson(graph, bindings);
        try {
            return encoder.mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new InternalCompilerError("Could not serialize graph: " + ex.getMessage());
        }
    }
}
