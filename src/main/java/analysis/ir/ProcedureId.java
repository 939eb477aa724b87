package analysis.ir;

/**
 * Unique identifier for a procedure: its fully qualified name and its signature. Two descriptors with the same name but
 * different signatures (e.g. overloads) are different procedures.
 */
public final class ProcedureId implements Comparable<ProcedureId> {

    private final String name;
    private final String signature;
    private final String asString;

    /**
     * Create a procedure identifier
     *
     * @param name
     *            fully qualified procedure name
     * @param signature
     *            parameter and return types, e.g. "(LObject;I)V", may be empty
     */
    public ProcedureId(String name, String signature) {
        assert name != null && !name.isEmpty() : "procedure needs a name";
        this.name = name;
        this.signature = signature == null ? "" : signature;
        this.asString = this.name + this.signature;
    }

    /**
     * Procedure without a signature (languages without overloading)
     *
     * @param name
     *            procedure name
     * @return identifier with an empty signature
     */
    public static ProcedureId of(String name) {
        return new ProcedureId(name, "");
    }

    public String getName() {
        return name;
    }

    public String getSignature() {
        return signature;
    }

    @Override
    public int compareTo(ProcedureId o) {
        return asString.compareTo(o.asString);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ProcedureId)) {
            return false;
        }
        return asString.equals(((ProcedureId) obj).asString);
    }

    @Override
    public int hashCode() {
        return asString.hashCode();
    }

    @Override
    public String toString() {
        return asString;
    }
}
