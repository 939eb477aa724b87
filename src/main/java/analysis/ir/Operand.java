package analysis.ir;

/**
 * Value read by an instruction: a local variable, the null constant, or an integer constant
 */
public abstract class Operand {

    /**
     * The null constant
     */
    public static final Operand NULL = new NullConstant();

    Operand() {
        // only the nested subclasses
    }

    public static Operand var(String name) {
        return new Variable(name);
    }

    public static Operand intConst(long value) {
        return new IntConstant(value);
    }

    public boolean isVariable() {
        return false;
    }

    /**
     * Local variable operand
     */
    public static final class Variable extends Operand {
        private final String name;

        Variable(String name) {
            assert name != null && !name.isEmpty();
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean isVariable() {
            return true;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Variable && ((Variable) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * The null constant
     */
    public static final class NullConstant extends Operand {
        NullConstant() {
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof NullConstant;
        }

        @Override
        public int hashCode() {
            return 0;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    /**
     * Integer (or boolean) constant
     */
    public static final class IntConstant extends Operand {
        private final long value;

        IntConstant(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof IntConstant && ((IntConstant) obj).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }
}
