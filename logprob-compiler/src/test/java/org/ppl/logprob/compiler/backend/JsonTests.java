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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.Assert;
import org.junit.Test;
import org.ppl.logprob.compiler.MeasurableIR;
import org.ppl.logprob.compiler.MeasurableIRBuilder;
import org.ppl.logprob.compiler.errors.CompilationError;
import org.ppl.logprob.ir.Constant;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.IncSubtensorOp;
import org.ppl.logprob.ir.op.IndexEntry;
import org.ppl.logprob.ir.op.OpKind;
import org.ppl.logprob.ir.op.RandomVariableOp;
import org.ppl.logprob.ir.value.NDArray;

import java.util.List;
import java.util.Map;

public class JsonTests {
    static final String MODEL = """
            {
              "variables": [
                { "id": 0, "name": "mu", "type": { "dtype": "float64", "shape": [] } },
                { "id": 1, "value": { "dtype": "float64", "shape": [], "data": [1] } },
                { "id": 2, "name": "X",
                  "op": { "kind": "random_variable", "distribution": "normal", "size": [4] },
                  "inputs": [0, 1] },
                { "id": 3, "value": { "dtype": "float64", "shape": [2], "data": [10, 20] } },
                { "id": 4, "name": "Y",
                  "op": { "kind": "inc_subtensor", "indices": [ { "array": [0, 2] } ], "set": true },
                  "inputs": [2, 3] },
                { "id": 5, "name": "y", "type": { "dtype": "float64", "shape": [4] } }
              ],
              "bindings": [ { "rv": 4, "value": 5 } ]
            }""";

    @Test
    public void decode() {
        JsonDecoder.Model model = JsonDecoder.decode(MODEL);
        Assert.assertEquals(6, model.variables().size());
        Variable x = model.getVariable(2);
        Assert.assertEquals("X", x.getName());
        Assert.assertNotNull(x.owner);
        RandomVariableOp op = x.owner.op.to(RandomVariableOp.class);
        Assert.assertEquals("normal", op.distribution);
        Assert.assertEquals(List.of(4), op.size);
        Assert.assertSame(model.getVariable(0), x.owner.getInput(0));

        Variable sigma = model.getVariable(1);
        Assert.assertTrue(sigma instanceof Constant);
        Assert.assertEquals(NDArray.scalar(1), ((Constant) sigma).value);

        Variable y = model.getVariable(4);
        IncSubtensorOp inc = y.owner.op.to(IncSubtensorOp.class);
        Assert.assertTrue(inc.setInstead);
        Assert.assertEquals(List.of(IndexEntry.array(0, 2)), inc.indices);
        Assert.assertEquals(Map.of(y, model.getVariable(5)), model.bindings());

        Assert.assertThrows(CompilationError.class, () -> model.getVariable(10));
    }

    @Test
    public void decodeAndBuild() {
        JsonDecoder.Model model = JsonDecoder.decode(MODEL);
        MeasurableIR result = new MeasurableIRBuilder().construct(model.bindings());
        Variable output = result.graph().getOutput(0);
        Assert.assertSame(result.getClone(model.getVariable(2)), output);
        Assert.assertSame(model.getVariable(5),
                result.originalValues().get(result.rvValues().get(output)));
    }

    @Test
    public void encode() {
        JsonDecoder.Model model = JsonDecoder.decode(MODEL);
        MeasurableIR result = new MeasurableIRBuilder().construct(model.bindings());
        ObjectNode json = new ToJson().toJson(result.graph(), result.rvValues());

        JsonNode variables = json.get("variables");
        // Dependencies are written first
        for (int i = 0; i < variables.size(); i++) {
            JsonNode variable = variables.get(i);
            Assert.assertEquals(i, variable.get("id").asInt());
            if (variable.has("inputs"))
                for (JsonNode input: variable.get("inputs"))
                    Assert.assertTrue(input.asInt() < i);
        }
        Assert.assertEquals(1, json.get("outputs").size());
        Assert.assertEquals(1, json.get("bindings").size());
        long rv = json.get("bindings").get(0).get("rv").asLong();
        Assert.assertEquals(json.get("outputs").get(0).asLong(), rv);
        Assert.assertEquals("random_variable", variables.get((int) rv).get("op").get("kind").asText());

        // The output can be read back
        JsonDecoder.Model decoded = JsonDecoder.decode(ToJson.toJsonString(result.graph(), result.rvValues()));
        Assert.assertEquals(1, decoded.bindings().size());
        Variable bound = decoded.bindings().keySet().iterator().next();
        Assert.assertEquals(OpKind.RANDOM_VARIABLE, bound.owner.op.kind());
        Variable value = decoded.bindings().get(bound);
        Assert.assertEquals(OpKind.INC_SUBTENSOR, value.owner.op.kind());
    }

    static void fails(String json, String message) {
        CompilationError error = Assert.assertThrows(CompilationError.class, () -> JsonDecoder.decode(json));
        Assert.assertTrue(error.getMessage(), error.getMessage().contains(message));
    }

    @Test
    public void errors() {
        fails("{", "Could not parse JSON model");
        fails("{}", "does not have property 'variables'");
        fails("""
                { "variables": [ { "id": 1, "op": { "kind": "elemwise", "opcode": "exp" }, "inputs": [0] } ] }""",
                "used before being defined");
        fails("""
                { "variables": [
                  { "id": 0, "type": { "dtype": "float64", "shape": [] } },
                  { "id": 0, "type": { "dtype": "float64", "shape": [] } } ] }""",
                "defined twice");
        fails("""
                { "variables": [ { "id": 0, "op": { "kind": "fft" }, "inputs": [] } ] }""",
                "Unknown operation kind 'fft'");
        fails("""
                { "variables": [
                  { "id": 0, "type": { "dtype": "float64", "shape": [] } },
                  { "id": 1, "op": { "kind": "random_variable", "distribution": "normal" }, "inputs": [0, 0] },
                  { "id": 2, "type": { "dtype": "float64", "shape": [3] } } ],
                  "bindings": [ { "rv": 1, "value": 2 } ] }""",
                "bound to");
        fails("""
                { "variables": [
                  { "id": 0, "type": { "dtype": "float64", "shape": [] } },
                  { "id": 1, "op": { "kind": "random_variable", "distribution": "normal" }, "inputs": [0, 0] },
                  { "id": 2, "type": { "dtype": "float64", "shape": [] } } ],
                  "bindings": [ { "rv": 1, "value": 2 }, { "rv": 1, "value": 0 } ] }""",
                "bound twice");
    }
}
