package analysis.ir;

/**
 * Exhaustive case analysis over the instruction kinds
 *
 * @param <R>
 *            result type
 */
public interface InstructionVisitor<R> {

    R visitLoad(LoadInstruction i);

    R visitStore(StoreInstruction i);

    R visitAssign(AssignInstruction i);

    R visitAllocate(AllocateInstruction i);

    R visitPrune(PruneInstruction i);

    R visitCall(CallInstruction i);

    R visitReturn(ReturnInstruction i);
}
