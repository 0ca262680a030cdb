package com.complexity.analyzer.visitor;

import com.complexity.analyzer.ast.*;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * Serializes a subtree to a JSON object: a {@code "node"} key with the node
 * kind plus one key per field. Absent optional fields are omitted, nested
 * nodes are expanded and lists keep their order.
 *
 * The result is the input of structural signatures and the payload sent to
 * the complexity oracle.
 */
public class NodeSerializer implements NodeVisitor<JsonObject, Void> {

    public static final String KIND_KEY = "node";

    private static final NodeSerializer INSTANCE = new NodeSerializer();

    public static JsonObject serialize(Node node) {
        return node.accept(INSTANCE, null);
    }

    private static JsonObject start(String kind) {
        JsonObject json = new JsonObject();
        json.addProperty(KIND_KEY, kind);
        return json;
    }

    private JsonArray serializeAll(List<? extends Node> nodes) {
        JsonArray array = new JsonArray();
        for (Node node : nodes) {
            array.add(node.accept(this, null));
        }
        return array;
    }

    private static JsonArray strings(List<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }

    private JsonElement child(Node node) {
        return node.accept(this, null);
    }

    @Override
    public JsonObject visit(Program program, Void arg) {
        JsonObject json = start("Program");
        json.addProperty("name", program.getName());
        json.add("classes", serializeAll(program.getClasses()));
        json.add("procedures", serializeAll(program.getProcedures()));
        json.add("main_block", child(program.getMainBlock()));
        return json;
    }

    @Override
    public JsonObject visit(ClassDef classDef, Void arg) {
        JsonObject json = start("ClassDef");
        json.addProperty("name", classDef.getName());
        json.add("attributes", strings(classDef.getAttributes()));
        return json;
    }

    @Override
    public JsonObject visit(ProcedureDef procedureDef, Void arg) {
        JsonObject json = start("ProcedureDef");
        json.addProperty("name", procedureDef.getName());
        json.add("params", serializeAll(procedureDef.getParameters()));
        json.add("body", child(procedureDef.getBody()));
        return json;
    }

    @Override
    public JsonObject visit(Parameter parameter, Void arg) {
        JsonObject json = start("Parameter");
        json.addProperty("name", parameter.getName());
        json.addProperty("type_info", parameter.getKind().getDisplayName());
        parameter.getClassName().ifPresent(className -> json.addProperty("class_name", className));
        return json;
    }

    @Override
    public JsonObject visit(Block block, Void arg) {
        JsonObject json = start("Block");
        json.add("statements", serializeAll(block.getStatements()));
        return json;
    }

    @Override
    public JsonObject visit(Assignment assignment, Void arg) {
        JsonObject json = start("Assignment");
        json.add("target", child(assignment.getTarget()));
        json.add("value", child(assignment.getValue()));
        return json;
    }

    @Override
    public JsonObject visit(IfStatement ifStatement, Void arg) {
        JsonObject json = start("IfStatement");
        json.add("condition", child(ifStatement.getCondition()));
        json.add("then_block", child(ifStatement.getThenBlock()));
        ifStatement.getElseBlock().ifPresent(elseBlock -> json.add("else_block", child(elseBlock)));
        return json;
    }

    @Override
    public JsonObject visit(ForLoop forLoop, Void arg) {
        JsonObject json = start("ForLoop");
        json.addProperty("variable", forLoop.getVariable());
        json.add("start_value", child(forLoop.getStart()));
        json.add("end_value", child(forLoop.getEnd()));
        json.add("body", child(forLoop.getBody()));
        return json;
    }

    @Override
    public JsonObject visit(WhileLoop whileLoop, Void arg) {
        JsonObject json = start("WhileLoop");
        json.add("condition", child(whileLoop.getCondition()));
        json.add("body", child(whileLoop.getBody()));
        return json;
    }

    @Override
    public JsonObject visit(RepeatLoop repeatLoop, Void arg) {
        JsonObject json = start("RepeatLoop");
        json.add("condition", child(repeatLoop.getCondition()));
        json.add("body", child(repeatLoop.getBody()));
        return json;
    }

    @Override
    public JsonObject visit(Call call, Void arg) {
        JsonObject json = start("Call");
        json.addProperty("procedure_name", call.getProcedureName());
        json.add("arguments", serializeAll(call.getArguments()));
        return json;
    }

    @Override
    public JsonObject visit(BinaryOp binaryOp, Void arg) {
        JsonObject json = start("BinaryOp");
        json.add("left", child(binaryOp.getLeft()));
        json.addProperty("operator", binaryOp.getOperator());
        json.add("right", child(binaryOp.getRight()));
        return json;
    }

    @Override
    public JsonObject visit(UnaryOp unaryOp, Void arg) {
        JsonObject json = start("UnaryOp");
        json.addProperty("operator", unaryOp.getOperator());
        json.add("operand", child(unaryOp.getOperand()));
        return json;
    }

    @Override
    public JsonObject visit(Literal literal, Void arg) {
        JsonObject json = start("Literal");
        json.addProperty("value", literal.getValue());
        json.addProperty("type_name", literal.getKind().getDisplayName());
        return json;
    }

    @Override
    public JsonObject visit(Variable variable, Void arg) {
        JsonObject json = start("Variable");
        json.addProperty("name", variable.getName());
        return json;
    }

    @Override
    public JsonObject visit(ArrayAccess arrayAccess, Void arg) {
        JsonObject json = start("ArrayAccess");
        json.addProperty("array_name", arrayAccess.getBaseText());
        json.add("index", child(arrayAccess.getIndex()));
        return json;
    }

    @Override
    public JsonObject visit(FieldAccess fieldAccess, Void arg) {
        JsonObject json = start("FieldAccess");
        json.addProperty("object_name", fieldAccess.getBaseText());
        json.addProperty("field_name", fieldAccess.getFieldName());
        return json;
    }
}
