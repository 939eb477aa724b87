package analysis.dataflow;

import analysis.ir.Instruction;
import analysis.ir.Location;

/**
 * Thrown when an instruction cannot be interpreted, e.g. it uses a variable that was never defined or has the wrong
 * number of arguments. The procedure being analyzed gets a conservative placeholder summary.
 */
public class MalformedInstructionException extends RuntimeException {

    private static final long serialVersionUID = -4120153624513383420L;

    private Location location;

    public MalformedInstructionException(String message) {
        super(message);
    }

    public MalformedInstructionException(Instruction i, String message) {
        super(message + " in \"" + i + "\"");
    }

    /**
     * Location of the offending instruction, filled in by the solver
     *
     * @return location or null if not known
     */
    public Location getLocation() {
        return location;
    }

    void setLocation(Location location) {
        if (this.location == null) {
            this.location = location;
        }
    }

    @Override
    public String getMessage() {
        return location == null ? super.getMessage() : super.getMessage() + " at " + location;
    }
}
