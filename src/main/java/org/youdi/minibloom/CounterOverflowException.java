package org.youdi.minibloom;

/**
 * Thrown by a counting filter under {@link Config.OverflowPolicy#FAIL} when an add would push a
 * counter past {@link CounterStore#MAX_COUNT}.
 */
public class CounterOverflowException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  private final int slot;

  public CounterOverflowException(int slot, int count) {
    super("Counter overflow at slot " + slot + ", count=" + count + ", maxCount="
          + CounterStore.MAX_COUNT);
    this.slot = slot;
  }

  public int getSlot() {
    return slot;
  }
}
