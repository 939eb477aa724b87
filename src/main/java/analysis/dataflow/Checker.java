package analysis.dataflow;

/**
 * A named abstract domain that reports issues
 */
public final class Checker<D, S> {

    private final String name;
    private final AbstractDomain<D, S> domain;

    public Checker(String name, AbstractDomain<D, S> domain) {
        this.name = name;
        this.domain = domain;
    }

    public String getName() {
        return name;
    }

    public AbstractDomain<D, S> getDomain() {
        return domain;
    }

    @Override
    public String toString() {
        return name;
    }
}
