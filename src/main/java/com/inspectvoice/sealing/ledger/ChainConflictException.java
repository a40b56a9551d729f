package com.inspectvoice.sealing.ledger;

/**
 * Compare-and-append lost: the tenant head moved after the predecessor was read.
 */
public class ChainConflictException extends RuntimeException {

    private final String tenantId;
    private final String expectedHead;
    private final String actualHead;

    public ChainConflictException(String tenantId, String expectedHead, String actualHead) {
        super("Chain head moved for tenant " + tenantId + ": expected " + describe(expectedHead)
                + " but found " + describe(actualHead));
        this.tenantId = tenantId;
        this.expectedHead = expectedHead;
        this.actualHead = actualHead;
    }

    private static String describe(String head) {
        return head == null ? "<genesis>" : head;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getExpectedHead() {
        return expectedHead;
    }

    public String getActualHead() {
        return actualHead;
    }
}
