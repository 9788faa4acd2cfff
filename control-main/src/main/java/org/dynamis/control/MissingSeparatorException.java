package org.dynamis.control;

public class MissingSeparatorException extends ControlFlowException {

    private final String keyword;
    private final int slotCount;

    public MissingSeparatorException(String keyword, int slotCount) {
        super("A separator must be provided when '" + keyword + "' has " + slotCount + " expressions");
        this.keyword = keyword;
        this.slotCount = slotCount;
    }

    public String getKeyword() {
        return keyword;
    }

    public int getSlotCount() {
        return slotCount;
    }
}
