/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.pyrewrite.pycomp.serialization;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.pyrewrite.ast.IR;
import com.google.pyrewrite.ast.Node;
import com.google.pyrewrite.ast.Token;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeCodecTest {

  private static Node decode(String json) {
    return NodeCodec.decode(JsonMappings.fromJson(json));
  }

  private static String decodeError(String json) {
    ReconstructionException e =
        assertThrows(ReconstructionException.class, () -> decode(json));
    return e.getMessage();
  }

  private static void assertRoundTrip(Node tree) {
    Node decoded = NodeCodec.decode(NodeCodec.encode(tree));
    assertThat(decoded.isEquivalentTo(tree)).isTrue();
    String json = JsonMappings.toJson(NodeCodec.encode(tree));
    Node throughJson = NodeCodec.decode(JsonMappings.fromJson(json));
    assertThat(throughJson.isEquivalentTo(tree)).isTrue();
  }

  @Test
  public void testEncodeName() {
    Map<String, Object> mapping = NodeCodec.encode(IR.name("x").setLinenoCharno(2, 6));
    assertThat(mapping.keySet())
        .containsExactly("node_type", "lineno", "col_offset", "id", "ctx")
        .inOrder();
    assertThat(mapping.get("node_type")).isEqualTo("Name");
    assertThat(mapping.get("lineno")).isEqualTo(2L);
    assertThat(mapping.get("col_offset")).isEqualTo(6L);
    assertThat(mapping.get("id")).isEqualTo("x");
    @SuppressWarnings("unchecked")
    Map<String, Object> ctx = (Map<String, Object>) mapping.get("ctx");
    assertThat(ctx).containsExactly("node_type", "Load");
  }

  @Test
  public void testEncodeOmitsMissingPositionAndKeepsNulls() {
    Map<String, Object> mapping = NodeCodec.encode(IR.returnNode());
    assertThat(mapping).containsExactly("node_type", "Return", "value", null);
  }

  @Test
  public void testEncodeLists() {
    Map<String, Object> mapping = NodeCodec.encode(IR.module(IR.pass(), IR.breakNode()));
    List<?> body = (List<?>) mapping.get("body");
    assertThat(body).hasSize(2);
    assertThat(((Map<?, ?>) body.get(1)).get("node_type")).isEqualTo("Break");
  }

  @Test
  public void testRoundTrips() {
    assertRoundTrip(IR.module());
    Node function =
        IR.functionDef(
            "f",
            IR.arguments(IR.arg("a")),
            ImmutableList.of(
                IR.forNode(
                    IR.storeName("i"),
                    IR.call(IR.name("range"), IR.number(3)),
                    ImmutableList.of(
                        IR.augAssign(
                            IR.storeName("a"),
                            Token.ADD,
                            IR.binOp(IR.name("i"), Token.MULT, IR.constant(0.5))))),
                IR.returnNode(
                    IR.joinedStr(IR.string("a="), IR.formattedValue(IR.name("a"))))));
    assertRoundTrip(IR.module(function, IR.exprResult(IR.constant(true))));
  }

  @Test
  public void testRoundTripKeepsPositions() {
    Node statement = IR.exprResult(IR.name("x").setLinenoCharno(4, 2)).setLinenoCharno(4, 2);
    Node module = IR.module(statement);
    Node decoded = NodeCodec.decode(NodeCodec.encode(module));
    Node name = decoded.getChildren("body").get(0).getNode("value");
    assertThat(name.getLineno()).isEqualTo(4);
    assertThat(name.getCharno()).isEqualTo(2);
  }

  @Test
  public void testDecodeWithoutPositions() {
    Node node = decode("{\"node_type\": \"Pass\"}");
    assertThat(node.getToken()).isEqualTo(Token.PASS);
    assertThat(node.hasPosition()).isFalse();
  }

  @Test
  public void testDecodeLineWithoutColumn() {
    Node node = decode("{\"node_type\": \"Pass\", \"lineno\": 3}");
    assertThat(node.getLineno()).isEqualTo(3);
    assertThat(node.getCharno()).isEqualTo(0);
  }

  @Test
  public void testDecodeDefaultsOmittedOptionalAndListFields() {
    Node call =
        decode(
            "{\"node_type\": \"Call\", \"func\": {\"node_type\": \"Name\", \"id\": \"f\","
                + " \"ctx\": {\"node_type\": \"Load\"}}}");
    assertThat(call.getChildren("args")).isEmpty();
    assertThat(call.getChildren("keywords")).isEmpty();
  }

  @Test
  public void testDecodeIgnoresForeignKeys() {
    Node constant =
        decode(
            "{\"node_type\": \"Constant\", \"value\": 1, \"kind\": null,"
                + " \"end_lineno\": 1, \"end_col_offset\": 5}");
    assertThat(constant.getValue("value")).isEqualTo(1L);
    Node module = decode("{\"node_type\": \"Module\", \"body\": [], \"type_ignores\": []}");
    assertThat(module.isModule()).isTrue();
  }

  @Test
  public void testDecodeScalars() {
    Node text = decode("{\"node_type\": \"Constant\", \"value\": \"hi\"}");
    assertThat(text.getValue("value")).isEqualTo("hi");
    Node real = decode("{\"node_type\": \"Constant\", \"value\": 2.0}");
    assertThat(real.getValue("value")).isEqualTo(2.0);
    Node none = decode("{\"node_type\": \"Constant\", \"value\": null}");
    assertThat(none.getValue("value")).isNull();
  }

  @Test
  public void testMissingOrUnknownType() {
    assertThat(decodeError("{\"id\": \"x\"}")).isEqualTo("$: missing 'node_type'");
    assertThat(decodeError("{\"node_type\": 3}")).isEqualTo("$: 'node_type' must be a string");
    assertThat(decodeError("{\"node_type\": \"Lambda\"}"))
        .isEqualTo("$: unknown node type 'Lambda'");
  }

  @Test
  public void testStrictFields() {
    assertThat(decodeError("{\"node_type\": \"Pass\", \"value\": 1}"))
        .isEqualTo("$: unexpected field 'value' for Pass");
    assertThat(decodeError("{\"node_type\": \"Name\", \"ctx\": {\"node_type\": \"Load\"}}"))
        .isEqualTo("$: Name is missing the field 'id'");
    assertThat(decodeError("{\"node_type\": \"Module\", \"body\": [], \"type_ignores\": [1]}"))
        .isEqualTo("$: Module.type_ignores is not supported");
  }

  @Test
  public void testBadValues() {
    assertThat(decodeError("{\"node_type\": \"Expr\", \"value\": null}"))
        .isEqualTo("$.value: must not be null");
    assertThat(decodeError("{\"node_type\": \"Module\", \"body\": {}}"))
        .isEqualTo("$.body: expected a list");
    assertThat(decodeError("{\"node_type\": \"Module\", \"body\": [\"pass\"]}"))
        .isEqualTo("$.body[0]: expected a node but found String pass");
    assertThat(
            decodeError(
                "{\"node_type\": \"Name\", \"id\": 7, \"ctx\": {\"node_type\": \"Load\"}}"))
        .isEqualTo("$.id: Name.id cannot hold Long 7");
    assertThat(decodeError("{\"node_type\": \"Constant\", \"value\": [1]}"))
        .isEqualTo("$.value: Constant.value cannot hold a list");
  }

  @Test
  public void testWrongChildCategory() {
    assertThat(
            decodeError(
                "{\"node_type\": \"Module\", \"body\": [{\"node_type\": \"Expr\","
                    + " \"value\": {\"node_type\": \"Pass\"}}]}"))
        .isEqualTo("$.body[0].value: Expr.value cannot hold Pass");
  }

  @Test
  public void testBadPositions() {
    assertThat(decodeError("{\"node_type\": \"Pass\", \"lineno\": -1}"))
        .isEqualTo("$.lineno: expected a non-negative integer but found Long -1");
    assertThat(decodeError("{\"node_type\": \"Pass\", \"lineno\": 1, \"col_offset\": \"0\"}"))
        .isEqualTo("$.col_offset: expected a non-negative integer but found String 0");
  }

  @Test
  public void testErrorPathReportsDepth() {
    ReconstructionException e =
        assertThrows(
            ReconstructionException.class,
            () ->
                decode(
                    "{\"node_type\": \"Module\", \"body\": [{\"node_type\": \"Pass\"},"
                        + " {\"node_type\": \"Expr\", \"value\": {\"node_type\": \"Nope\"}}]}"));
    assertThat(e.getPath()).isEqualTo("$.body[1].value");
  }

  @Test
  public void testNonFiniteConstantsSurviveJson() {
    assertRoundTrip(
        IR.module(
            IR.exprResult(IR.constant(Double.POSITIVE_INFINITY)),
            IR.exprResult(IR.constant(Double.NEGATIVE_INFINITY)),
            IR.exprResult(IR.constant(Double.NaN)),
            IR.exprResult(IR.string("Infinity"))));
  }
}
