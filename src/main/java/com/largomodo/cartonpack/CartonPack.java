package com.largomodo.cartonpack;

import com.largomodo.cartonpack.core.domain.CartonPacker;
import com.largomodo.cartonpack.core.domain.CartonType;
import com.largomodo.cartonpack.core.domain.GreedyCartonPacker;
import com.largomodo.cartonpack.core.domain.PackingResult;
import com.largomodo.cartonpack.core.domain.PackingSummary;
import com.largomodo.cartonpack.core.domain.Product;
import com.largomodo.cartonpack.core.domain.ValidationException;
import com.largomodo.cartonpack.format.ReportFormat;
import com.largomodo.cartonpack.format.ReportFormatter;
import com.largomodo.cartonpack.util.DimensionSpecParser;
import com.largomodo.cartonpack.util.DimensionSpecParser.DimensionSpec;
import com.largomodo.cartonpack.util.LengthUnit;
import com.largomodo.cartonpack.util.ProductShape;
import com.largomodo.cartonpack.util.WeightUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for carton allocation.
 * <p>
 * Decodes one product and an ordered list of carton types from the command line, runs a single
 * allocation and renders the plan. Owns no allocation logic.
 * <p>
 * Exit codes separate caller mistakes from defects:
 * - 0: every unit packed
 * - 1: unexpected failure (logged with stack trace)
 * - 2: invalid arguments, including non-positive dimensions, weights or quantities
 * - 3: allocation finished but some units could not be packed
 */
@Command(
        name = "cartonpack",
        mixinStandardHelpOptions = true,
        resourceBundle = "cartonpack.cartonpack",
        version = "${bundle:application.version}",
        header = "Allocates units of one product to an inventory of carton types.",
        description = {
                "Packs as many units as possible into the fewest cartons, one carton at a time, trying all six" +
                        " axis-aligned orientations of the product in every carton type.",
                "",
                "Each carton's usable interior is its stated size minus the clearance buffer on every axis.",
                "Weight limits cap the units per carton regardless of free space.",
                "Cartons are stated in inches and kilograms; product values are converted from --unit and" +
                        " --weight-unit."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:All units packed",
                "1:Unexpected error",
                "2:Invalid command line arguments or values",
                "3:Some units could not be packed"
        }
)
public class CartonPack implements Callable<Integer> {

    static final int EXIT_PARTIAL = 3;

    static final String INTERNAL_ERROR_MESSAGE =
            "Internal error during packing calculation. See the log for details.";

    private static final Logger log = LoggerFactory.getLogger(CartonPack.class);

    @Option(names = {"-p", "--product"}, required = true, paramLabel = "DIMENSIONS:WEIGHT:QTY",
            converter = DimensionSpecConverter.class,
            description = {
                    "Product dimensions, unit weight and quantity to pack.",
                    "Dimensions follow the shape: LxBxH (cuboid), SIDE (cube), DIAMETERxHEIGHT (cylinder)"
                            + " or DIAMETER (sphere).",
                    "Example: 10x10x10:1:8"
            })
    DimensionSpec productSpec;

    @Option(names = {"-c", "--carton"}, required = true, paramLabel = "LxBxH:MAX_WEIGHT:QTY",
            converter = DimensionSpecConverter.class,
            description = {
                    "Carton type: exterior dimensions in inches, maximum load in kilograms and cartons on hand.",
                    "Repeat for each carton type. Order matters: earlier types win ties.",
                    "Example: 21x21x21:100:1"
            })
    List<DimensionSpec> cartonSpecs = new ArrayList<>();

    @Option(names = {"--shape"}, defaultValue = "CUBOID",
            description = {
                    "Product shape; round shapes are packed by their bounding box.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    ProductShape shape;

    @Option(names = {"-u", "--unit"}, defaultValue = "IN",
            description = {
                    "Unit of the product dimensions, converted to inches.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    LengthUnit unit;

    @Option(names = {"-w", "--weight-unit"}, defaultValue = "KG",
            description = {
                    "Unit of the product weight, converted to kilograms.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    WeightUnit weightUnit;

    @Option(names = {"-b", "--buffer"}, defaultValue = "1",
            description = "Clearance subtracted from every carton dimension (default: ${DEFAULT-VALUE})")
    double buffer;

    @Option(names = {"-f", "--format"}, defaultValue = "TEXT",
            description = {
                    "Report format.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    ReportFormat format;

    @Option(names = {"-s", "--summary"}, description = "Append volume and weight utilisation statistics")
    boolean summary;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    private final CartonPacker packer;

    public CartonPack() {
        this(new GreedyCartonPacker());
    }

    CartonPack(CartonPacker packer) {
        this.packer = packer;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine(new CartonPack()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Configures a command line the way {@link #main} runs it: case-insensitive enums and
     * generic reporting of unexpected failures.
     */
    static CommandLine createCommandLine(CartonPack command) {
        CommandLine cmd = new CommandLine(command);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            log.error("Allocation failed unexpectedly", ex);
            commandLine.getErr().println(INTERNAL_ERROR_MESSAGE);
            return commandLine.getCommandSpec().exitCodeOnExecutionException();
        });
        return cmd;
    }

    @Override
    public Integer call() {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        Product product = decodeProduct();
        List<CartonType> cartons = decodeCartons();

        MDC.put("product", product.toString());
        try {
            log.debug("Allocating {} units across {} carton types", product.quantity(), cartons.size());
            PackingResult result = packer.allocate(product, cartons);

            PrintWriter out = spec.commandLine().getOut();
            ReportFormatter formatter = format.formatter();
            formatter.writePlan(result, out);
            if (summary) {
                formatter.writeSummary(PackingSummary.of(product, result), out);
            }
            out.flush();

            if (!result.isComplete()) {
                log.warn("Partial packing: {} of {} units could not be packed",
                        result.remainingDemand(), result.requestedQuantity());
                return EXIT_PARTIAL;
            }
            log.info("Packed {} units in {} cartons", result.packedQuantity(), result.totalCartonsUsed());
            return 0;
        } finally {
            MDC.remove("product");
        }
    }

    private Product decodeProduct() {
        double[] box;
        try {
            box = shape.boundingBox(productSpec.dimensions());
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "--product: " + e.getMessage(), e);
        }
        try {
            return new Product(unit.toInches(box[0]), unit.toInches(box[1]), unit.toInches(box[2]),
                    weightUnit.toKilograms(productSpec.weight()), productSpec.quantity());
        } catch (ValidationException e) {
            throw new ParameterException(spec.commandLine(), "Invalid product: " + e.getMessage(), e);
        }
    }

    private List<CartonType> decodeCartons() {
        List<CartonType> cartons = new ArrayList<>(cartonSpecs.size());
        for (int i = 0; i < cartonSpecs.size(); i++) {
            DimensionSpec parsed = cartonSpecs.get(i);
            List<Double> dims = parsed.dimensions();
            if (dims.size() != 3) {
                throw new ParameterException(spec.commandLine(), "Invalid carton " + (i + 1)
                        + ": expected LENGTHxBREADTHxHEIGHT, got " + dims.size() + " dimension(s)");
            }
            try {
                cartons.add(new CartonType(dims.get(0), dims.get(1), dims.get(2),
                        parsed.weight(), parsed.quantity(), buffer));
            } catch (ValidationException e) {
                throw new ParameterException(spec.commandLine(),
                        "Invalid carton " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return cartons;
    }

    /**
     * Turns descriptor text into a {@link DimensionSpec}; malformed text becomes a parameter error.
     */
    public static final class DimensionSpecConverter implements ITypeConverter<DimensionSpec> {

        @Override
        public DimensionSpec convert(String value) {
            try {
                return DimensionSpecParser.parse(value);
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException(e.getMessage());
            }
        }
    }
}
