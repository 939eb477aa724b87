package analysis.dataflow;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.json.JSONArray;

import util.OrderedPair;
import analysis.ir.CallInstruction;
import analysis.ir.Instruction;
import analysis.ir.Location;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import analysis.summary.SummaryCodec;

/**
 * Runs two domains side by side in a single traversal of the control flow graph. Every operation is applied
 * component-wise; the two components never exchange information.
 */
public final class ProductDomain<D1, S1, D2, S2> implements
        AbstractDomain<OrderedPair<D1, D2>, OrderedPair<S1, S2>> {

    private final AbstractDomain<D1, S1> first;
    private final AbstractDomain<D2, S2> second;
    private final SummaryCodec<OrderedPair<S1, S2>> codec;

    public ProductDomain(AbstractDomain<D1, S1> first, AbstractDomain<D2, S2> second) {
        this.first = first;
        this.second = second;
        final SummaryCodec<S1> c1 = first.codec();
        final SummaryCodec<S2> c2 = second.codec();
        this.codec = new SummaryCodec<OrderedPair<S1, S2>>() {
            @Override
            public Object toJSON(OrderedPair<S1, S2> payload) {
                JSONArray arr = new JSONArray();
                arr.put(c1.toJSON(payload.fst()));
                arr.put(c2.toJSON(payload.snd()));
                return arr;
            }

            @Override
            public OrderedPair<S1, S2> fromJSON(Object json) {
                JSONArray arr = (JSONArray) json;
                return new OrderedPair<>(c1.fromJSON(arr.get(0)), c2.fromJSON(arr.get(1)));
            }
        };
    }

    public AbstractDomain<D1, S1> getFirst() {
        return first;
    }

    public AbstractDomain<D2, S2> getSecond() {
        return second;
    }

    @Override
    public OrderedPair<D1, D2> initialState(ProcedureDescriptor pd) {
        return new OrderedPair<>(first.initialState(pd), second.initialState(pd));
    }

    @Override
    public OrderedPair<D1, D2> bottom() {
        return new OrderedPair<>(first.bottom(), second.bottom());
    }

    @Override
    public OrderedPair<D1, D2> transfer(OrderedPair<D1, D2> d, Instruction i) {
        return new OrderedPair<>(first.transfer(d.fst(), i), second.transfer(d.snd(), i));
    }

    @Override
    public OrderedPair<D1, D2> join(OrderedPair<D1, D2> d1, OrderedPair<D1, D2> d2) {
        return new OrderedPair<>(first.join(d1.fst(), d2.fst()), second.join(d1.snd(), d2.snd()));
    }

    @Override
    public OrderedPair<D1, D2> widen(OrderedPair<D1, D2> older, OrderedPair<D1, D2> newer, int iteration) {
        return new OrderedPair<>(first.widen(older.fst(), newer.fst(), iteration), second.widen(older.snd(),
                                                                                               newer.snd(),
                                                                                               iteration));
    }

    @Override
    public boolean leq(OrderedPair<D1, D2> d1, OrderedPair<D1, D2> d2) {
        return first.leq(d1.fst(), d2.fst()) && second.leq(d1.snd(), d2.snd());
    }

    @Override
    public OrderedPair<D1, D2> applySummary(OrderedPair<D1, D2> caller, OrderedPair<S1, S2> calleeSummary,
                                            CallInstruction call) {
        return new OrderedPair<>(first.applySummary(caller.fst(), calleeSummary.fst(), call),
                                 second.applySummary(caller.snd(), calleeSummary.snd(), call));
    }

    @Override
    public OrderedPair<S1, S2> extractSummary(ProcedureDescriptor pd, Set<OrderedPair<D1, D2>> exitStates) {
        Set<D1> s1 = new LinkedHashSet<>();
        Set<D2> s2 = new LinkedHashSet<>();
        for (OrderedPair<D1, D2> d : exitStates) {
            s1.add(d.fst());
            s2.add(d.snd());
        }
        return new OrderedPair<>(first.extractSummary(pd, s1), second.extractSummary(pd, s2));
    }

    @Override
    public List<Issue> report(OrderedPair<D1, D2> d, Instruction i, Location loc) {
        List<Issue> issues = new ArrayList<>(first.report(d.fst(), i, loc));
        issues.addAll(second.report(d.snd(), i, loc));
        return issues;
    }

    @Override
    public List<Issue> reportCall(OrderedPair<D1, D2> d, ProcedureId callee, OrderedPair<S1, S2> calleeSummary,
                                  CallInstruction call, Location loc) {
        List<Issue> issues = new ArrayList<>(first.reportCall(d.fst(), callee, calleeSummary.fst(), call, loc));
        issues.addAll(second.reportCall(d.snd(), callee, calleeSummary.snd(), call, loc));
        return issues;
    }

    @Override
    public OrderedPair<S1, S2> conservativeSummary(ProcedureId id, int arity) {
        return new OrderedPair<>(first.conservativeSummary(id, arity), second.conservativeSummary(id, arity));
    }

    @Override
    public OrderedPair<S1, S2> widenSummary(OrderedPair<S1, S2> previous, OrderedPair<S1, S2> current) {
        return new OrderedPair<>(first.widenSummary(previous.fst(), current.fst()),
                                 second.widenSummary(previous.snd(), current.snd()));
    }

    @Override
    public SummaryCodec<OrderedPair<S1, S2>> codec() {
        return codec;
    }

    @Override
    public String toString() {
        return "(" + first + " x " + second + ")";
    }
}
