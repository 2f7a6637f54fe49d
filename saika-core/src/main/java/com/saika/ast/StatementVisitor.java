package com.saika.ast;

/**
 * One method per statement kind, so a new kind cannot be added without every visitor
 * handling it.
 */
public interface StatementVisitor<R> {
    R visitPackage(PackageStatement node);
    R visitImport(ImportStatement node);
    R visitImportGroup(ImportGroup node);
    R visitFunction(FunctionStatement node);
    R visitVariable(VariableStatement node);
    R visitReturn(ReturnStatement node);
    R visitIf(IfStatement node);
    R visitFor(ForStatement node);
    R visitRange(RangeStatement node);
    R visitBlock(BlockStatement node);
    R visitBreak(BreakStatement node);
    R visitContinue(ContinueStatement node);
    R visitStruct(StructType node);
    R visitExpressionStatement(ExpressionStatement node);
}
