package org.chunksieve.program;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.chunksieve.isa.Instruction;
import org.chunksieve.isa.Opcode;
import org.chunksieve.isa.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthesizes the divisor search program for one {@link SearchBlock}.
 * <p>
 * Program layout:
 * <ol>
 *   <li>optional {@code IMPORT_WEIGHTS}</li>
 *   <li>{@code INIT(c, depth)} for every local chunk</li>
 *   <li>{@code STORE_LO/STORE_HI} pairs writing the modulus limbs</li>
 *   <li>{@code iterationCount} rounds of: store offset, {@code ORACLE(c, DIVISOR)}, {@code GROVER(c)} per chunk</li>
 *   <li>{@code MEASURE(c)} for every local chunk</li>
 *   <li>{@code HALT}</li>
 * </ol>
 * <p>
 * All engine limits are validated before the first instruction is emitted.
 * Instances are immutable and may be shared between worker threads.
 */
public class ProgramBuilder {

    private static final Logger log = LoggerFactory.getLogger(ProgramBuilder.class);

    /** Width of one register in bits. */
    public static final int LIMB_BITS = 64;

    private static final BigInteger LIMB_MASK = BigInteger.ONE.shiftLeft(LIMB_BITS).subtract(BigInteger.ONE);
    private static final int HALF_BITS = 16;
    private static final long HALF_MASK = 0xFFFFL;

    private final EngineLimits limits;
    private final RegisterLayout registers;
    private final boolean importWeights;

    /**
     * @param limits        capacities of the target engine
     * @param registers     input register addresses, disjoint from the measurement slots
     * @param importWeights whether to emit the weight import preamble
     */
    public ProgramBuilder(EngineLimits limits, RegisterLayout registers, boolean importWeights) {
        registers.requireDisjointFrom(limits.maxChunks());
        this.limits = limits;
        this.registers = registers;
        this.importWeights = importWeights;
    }

    public ProgramBuilder(EngineLimits limits, RegisterLayout registers) {
        this(limits, registers, false);
    }

    /**
     * Builds the program searching {@code block} for divisors of {@code modulus}.
     *
     * @param modulus        the integer to factor (at least 2)
     * @param chunkDepth     digits per chunk
     * @param block          the block to search
     * @param iterationCount refinement rounds; larger values cost runtime for a better hit rate
     * @return the program, terminated by {@code HALT}
     * @throws SizeExceededException    if the block, modulus, offsets or program exceed an engine limit
     * @throws IllegalArgumentException if an argument is out of range
     */
    public Program build(BigInteger modulus, int chunkDepth, SearchBlock block, int iterationCount) {
        if (modulus.compareTo(BigInteger.TWO) < 0) {
            throw new IllegalArgumentException("Modulus must be >= 2, got " + modulus);
        }
        if (iterationCount < 0) {
            throw new IllegalArgumentException("Iteration count must be >= 0, got " + iterationCount);
        }
        long chunkStates = limits.chunkStates(chunkDepth);

        if (block.activeChunks().compareTo(BigInteger.valueOf(limits.maxChunks())) > 0) {
            throw new SizeExceededException(String.format(
                    "Block %s needs %s chunks, engine addresses at most %d",
                    block, block.activeChunks(), limits.maxChunks()));
        }
        int activeChunks = block.activeChunks().intValueExact();

        List<BigInteger> modulusLimbs = toLimbs(modulus);
        if (modulusLimbs.size() > registers.modulusCapacity()) {
            throw new SizeExceededException(String.format(
                    "Modulus needs %d limbs (%d bits), only %d registers reserved",
                    modulusLimbs.size(), modulus.bitLength(), registers.modulusCapacity()));
        }

        BigInteger lastOffset = block.globalOffset(activeChunks - 1L, chunkStates);
        if (lastOffset.bitLength() > LIMB_BITS) {
            throw new SizeExceededException(String.format(
                    "Chunk offset %s of block %s does not fit one %d-bit register", lastOffset, block, LIMB_BITS));
        }

        long instructionCount = (importWeights ? 1L : 0L)
                + activeChunks
                + 2L * modulusLimbs.size()
                + 4L * activeChunks * iterationCount
                + activeChunks
                + 1L;
        if (instructionCount > limits.maxInstructions()) {
            throw new SizeExceededException(String.format(
                    "Program for %s with %d iterations needs %d instructions, engine accepts at most %d",
                    block, iterationCount, instructionCount, limits.maxInstructions()));
        }

        List<Instruction> program = new ArrayList<>((int) instructionCount);
        if (importWeights) {
            program.add(Instruction.of(Opcode.IMPORT_WEIGHTS));
        }
        for (int c = 0; c < activeChunks; c++) {
            program.add(Instruction.of(Opcode.INIT, c, chunkDepth));
        }
        for (int i = 0; i < modulusLimbs.size(); i++) {
            emitStore(program, registers.modulusBase() + i, modulusLimbs.get(i).longValue());
        }
        for (int round = 0; round < iterationCount; round++) {
            for (int c = 0; c < activeChunks; c++) {
                emitStore(program, registers.offsetRegister(), block.globalOffset(c, chunkStates).longValue());
                program.add(Instruction.of(Opcode.ORACLE, c, Opcode.ORACLE_DIVISOR));
                program.add(Instruction.of(Opcode.GROVER, c));
            }
        }
        for (int c = 0; c < activeChunks; c++) {
            program.add(Instruction.of(Opcode.MEASURE, c));
        }
        program.add(Instruction.of(Opcode.HALT));

        log.debug("Built program for {}: {} instructions, {} modulus limbs, {} iterations",
                block, program.size(), modulusLimbs.size(), iterationCount);
        return new Program(program);
    }

    /**
     * Splits a non-negative integer into 64-bit limbs, least significant first.
     * Zero yields a single zero limb.
     */
    public static List<BigInteger> toLimbs(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Value must be non-negative, got " + value);
        }
        List<BigInteger> limbs = new ArrayList<>();
        BigInteger rest = value;
        do {
            limbs.add(rest.and(LIMB_MASK));
            rest = rest.shiftRight(LIMB_BITS);
        } while (rest.signum() > 0);
        return limbs;
    }

    /**
     * Emits the paired stores of one 64-bit limb; each store carries 32 bits as two 16-bit halves.
     */
    private static void emitStore(List<Instruction> program, int register, long limb) {
        program.add(new Instruction(Opcode.STORE_LO, register, half(limb, 0), half(limb, 1)));
        program.add(new Instruction(Opcode.STORE_HI, register, half(limb, 2), half(limb, 3)));
    }

    private static int half(long limb, int index) {
        return (int) ((limb >>> (index * HALF_BITS)) & HALF_MASK);
    }
}
