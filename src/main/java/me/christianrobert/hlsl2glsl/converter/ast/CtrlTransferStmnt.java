package me.christianrobert.hlsl2glsl.converter.ast;

/**
 * {@code break}, {@code continue} or {@code discard}.
 */
public class CtrlTransferStmnt extends Stmnt {

    private final CtrlTransfer transfer;

    public CtrlTransferStmnt(SourceArea area, CtrlTransfer transfer) {
        super(area);
        if (transfer == null) {
            throw new IllegalArgumentException("Control transfer cannot be null");
        }
        this.transfer = transfer;
    }

    public CtrlTransfer getTransfer() {
        return transfer;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitCtrlTransferStmnt(this);
    }
}
