package com.onelang.compiler.ast;

import com.onelang.compiler.lexer.SourceLocation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AST 节点基类
 *
 * <p>节点构造后不可变；父节点独占其子节点。{@link #getMetadata()} 是留给工具链的开放槽位，
 * 编译管线本身不读写它。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;
    private Map<String, Object> metadata;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 附加元数据（惰性创建） */
    public Map<String, Object> getMetadata() {
        if (metadata == null) {
            metadata = new LinkedHashMap<String, Object>();
        }
        return metadata;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
