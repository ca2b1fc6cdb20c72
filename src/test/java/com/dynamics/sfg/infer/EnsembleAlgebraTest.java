package com.dynamics.sfg.infer;

import com.dynamics.sfg.fn.BinaryOp;
import com.dynamics.sfg.fn.UnaryFn;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class EnsembleAlgebraTest {

    private static Ensemble column(double... values) {
        return new Ensemble(values.length, 1, values.clone());
    }

    @Test
    public void testFailureEndsOnlyItsOwnDraw() {
        EnsembleAlgebra algebra = new EnsembleAlgebra(4);
        algebra.locate("root", 3);

        Ensemble roots = algebra.unary(UnaryFn.SQRT, column(-1, 4, -9, 16));

        assertEquals(2, algebra.failureCount());
        assertTrue(algebra.failed(0));
        assertFalse(algebra.failed(1));
        assertTrue(algebra.failed(2));
        assertEquals(2.0, roots.get(1, 0), 0.0);
        assertEquals(4.0, roots.get(3, 0), 0.0);
        assertTrue(Double.isNaN(roots.get(0, 0)));
        assertEquals("root", algebra.failure(0).reference());
        assertEquals(3, algebra.failure(0).step());
        assertEquals(2, algebra.failure(2).repetition());
    }

    @Test
    public void testFailedDrawsAreSkippedAfterwards() {
        EnsembleAlgebra algebra = new EnsembleAlgebra(2);
        algebra.locate("first", 0);
        Ensemble ratio = algebra.binary(BinaryOp.DIV, Ensemble.constant(new double[] { 1 }), column(0, 2));
        algebra.locate("second", 1);
        algebra.unary(UnaryFn.LOG, ratio);

        assertEquals("first", algebra.failure(0).reference());
        assertFalse(algebra.failed(1));
    }

    @Test
    public void testDeterministicFailureEndsEveryDrawThatNeedsIt() {
        EnsembleAlgebra algebra = new EnsembleAlgebra(4);
        Ensemble zero = Ensemble.constant(new double[] { 0 });
        Ensemble one = Ensemble.constant(new double[] { 1 });

        algebra.restrict(column(1, 0, 1, 0)).binary(BinaryOp.DIV, one, zero);

        assertTrue(algebra.failed(0));
        assertFalse(algebra.failed(1));
        assertTrue(algebra.failed(2));
        assertFalse(algebra.failed(3));

        EnsembleAlgebra unmasked = new EnsembleAlgebra(3);
        unmasked.binary(BinaryOp.DIV, one, zero);
        assertEquals(3, unmasked.failureCount());
    }

    @Test
    public void testOverlappingConditionsFailPerDraw() {
        EnsembleAlgebra algebra = new EnsembleAlgebra(2);
        Ensemble both = column(1, 0);
        Ensemble always = Ensemble.constant(new double[] { 1 });

        Ensemble out = algebra.piecewise(List.of(column(5, 6), column(7, 8)), List.of(both, always));

        assertTrue(algebra.failed(0));
        assertFalse(algebra.failed(1));
        assertEquals(8.0, out.get(1, 0), 0.0);
    }
}
