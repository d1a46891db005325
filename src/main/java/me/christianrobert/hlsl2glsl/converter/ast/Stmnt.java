package me.christianrobert.hlsl2glsl.converter.ast;

public abstract class Stmnt extends Node {

    protected Stmnt(SourceArea area) {
        super(area);
    }
}
