package org.janelia.identicon.cmd;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import org.janelia.identicon.model.GridCell;
import org.janelia.identicon.model.Identicon;
import org.janelia.identicon.pipeline.IdenticonGenerator;
import org.janelia.identicon.pipeline.IdenticonLayout;

/**
 * Command that prints the intermediate values computed for each input without writing any image.
 */
class ShowIdenticonsCmd extends AbstractCmd {

    @Parameters(commandDescription = "Print the hash, color and cell pattern computed for every input string")
    static class ShowIdenticonsArgs extends AbstractCmdArgs {
        ShowIdenticonsArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Parameter(names = {"--input", "-i"}, description = "Input strings", required = true, variableArity = true)
        List<String> inputs = new ArrayList<>();
    }

    private final ShowIdenticonsArgs args;
    private final IdenticonGenerator identiconGenerator;
    private final PrintStream out;

    ShowIdenticonsCmd(String commandName, PrintStream out) {
        super(commandName);
        this.args = new ShowIdenticonsArgs(new CommonArgs());
        this.identiconGenerator = new IdenticonGenerator();
        this.out = out;
    }

    @Override
    ShowIdenticonsArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        args.inputs.stream()
                .map(identiconGenerator::generate)
                .forEach(this::printIdenticon);
    }

    private void printIdenticon(Identicon identicon) {
        out.println("'" + identicon.getInput() + "'");
        out.println("  hash: " + identicon.getHash());
        out.println("  color: " + identicon.getColor().getRed()
                + "," + identicon.getColor().getGreen()
                + "," + identicon.getColor().getBlue());
        out.println("  painted cells: " + Arrays.toString(identicon.getPaintedCells().getIndices()));
        Set<Integer> painted = identicon.getPaintedCells().stream()
                .map(GridCell::getIndex)
                .collect(Collectors.toSet());
        for (int row = 0; row < IdenticonLayout.GRID_SIZE; row++) {
            StringBuilder rowBuilder = new StringBuilder("  ");
            for (int col = 0; col < IdenticonLayout.GRID_SIZE; col++) {
                rowBuilder.append(painted.contains(row * IdenticonLayout.GRID_SIZE + col) ? '#' : '.');
            }
            out.println(rowBuilder);
        }
    }
}
