package analysis.dataflow;

import java.util.List;
import java.util.Set;

import analysis.ir.CallInstruction;
import analysis.ir.Instruction;
import analysis.ir.Location;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import analysis.summary.SummaryCodec;

/**
 * Abstract domain plugged into the {@link FixpointSolver}. Implementations must be stateless (or immutable) so that a
 * single instance can be shared by concurrent workers; facts and summaries must be immutable and have equals and
 * hashCode defined.
 *
 * @param <D>
 *            data-flow fact (abstract state at a program point)
 * @param <S>
 *            procedure summary payload
 */
public interface AbstractDomain<D, S> {

    /**
     * State at the entry of the procedure
     */
    D initialState(ProcedureDescriptor pd);

    /**
     * State of unreachable code, the identity of {@link #join(Object, Object)}
     */
    D bottom();

    /**
     * Abstract semantics of a non-call instruction. Must be monotone.
     *
     * @param d
     *            state before the instruction
     * @param i
     *            instruction, never a {@link CallInstruction}
     * @return state after the instruction
     * @throws MalformedInstructionException
     *             if the instruction cannot be interpreted
     */
    D transfer(D d, Instruction i);

    D join(D d1, D d2);

    /**
     * Widen the old state with the new one so that increasing chains stabilize
     *
     * @param older
     *            previous input
     * @param newer
     *            new input
     * @param iteration
     *            number of times the node has been visited
     * @return upper bound of both
     */
    D widen(D older, D newer, int iteration);

    boolean leq(D d1, D d2);

    /**
     * Effect of a call given a summary of one candidate callee. The result may be a disjunction of caller states.
     *
     * @param caller
     *            state before the call
     * @param calleeSummary
     *            summary of the callee
     * @param call
     *            call instruction
     * @return state after the call
     */
    D applySummary(D caller, S calleeSummary, CallInstruction call);

    /**
     * Summary of a procedure from the states reaching its exit
     *
     * @param pd
     *            procedure
     * @param exitStates
     *            states at the exit node (empty if the exit is unreachable)
     * @return summary
     */
    S extractSummary(ProcedureDescriptor pd, Set<D> exitStates);

    /**
     * Issues found when the instruction is executed in the given state
     *
     * @param d
     *            state before the instruction
     * @param i
     *            instruction
     * @param loc
     *            location of the instruction
     * @return issues, empty if none
     */
    List<Issue> report(D d, Instruction i, Location loc);

    /**
     * Issues found when a call is made in the given state to a callee with the given summary, e.g. an argument that
     * violates what the callee requires
     *
     * @param d
     *            state before the call
     * @param callee
     *            candidate callee
     * @param calleeSummary
     *            summary of the callee
     * @param call
     *            call instruction
     * @param loc
     *            location of the call
     * @return issues, empty if none
     */
    List<Issue> reportCall(D d, ProcedureId callee, S calleeSummary, CallInstruction call, Location loc);

    /**
     * Summary assuming nothing about the procedure: used for callees without code and for procedures whose analysis
     * failed
     *
     * @param id
     *            procedure
     * @param arity
     *            number of arguments
     * @return sound over-approximation of any procedure
     */
    S conservativeSummary(ProcedureId id, int arity);

    /**
     * Widen summaries of a recursive procedure that keeps changing
     *
     * @param previous
     *            summary from the previous iteration over the SCC
     * @param current
     *            newly computed summary
     * @return summary at least as general as both
     */
    S widenSummary(S previous, S current);

    SummaryCodec<S> codec();
}
