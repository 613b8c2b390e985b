package com.largomodo.cartonpack.core.domain;

import com.largomodo.cartonpack.core.AllocationObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GreedyCartonPackerTest {

    private GreedyCartonPacker packer;

    @BeforeEach
    void setUp() {
        packer = new GreedyCartonPacker();
    }

    @Test
    void testSingleCartonHoldsWholeDemand() {
        Product product = new Product(10, 10, 10, 1, 8);
        List<CartonType> cartons = List.of(new CartonType(21, 21, 21, 100, 1, 1));

        PackingResult result = packer.allocate(product, cartons);

        assertEquals(1, result.entries().size());
        PackingPlanEntry entry = result.entries().get(0);
        assertEquals(0, entry.cartonIndex());
        assertEquals(Orientation.LBH, entry.orientation());
        assertEquals(2, entry.fitLengthwise());
        assertEquals(2, entry.fitBreadthwise());
        assertEquals(2, entry.fitHeightwise());
        assertEquals(1, entry.cartonsUsed());
        assertEquals(8, entry.totalItems());
        assertEquals(0, result.remainingDemand());
        assertTrue(result.isComplete());
    }

    @Test
    void testDemandExceedingStockLeavesRemainder() {
        Product product = new Product(10, 10, 10, 1, 10);
        List<CartonType> cartons = List.of(new CartonType(21, 21, 21, 100, 1, 1));

        PackingResult result = packer.allocate(product, cartons);

        assertEquals(1, result.entries().size());
        assertEquals(1, result.entries().get(0).cartonsUsed());
        assertEquals(8, result.entries().get(0).totalItems());
        assertEquals(2, result.remainingDemand());
        assertEquals(8, result.packedQuantity());
        assertFalse(result.isComplete());
    }

    @Test
    void testNoFeasibleCartonReturnsEmptyPlan() {
        Product product = new Product(30, 30, 30, 1, 5);
        List<CartonType> cartons = List.of(
                new CartonType(21, 21, 21, 100, 3),
                new CartonType(11, 41, 41, 100, 3)
        );

        PackingResult result = packer.allocate(product, cartons);

        assertTrue(result.entries().isEmpty());
        assertEquals(5, result.remainingDemand());
    }

    @Test
    void testEmptyCartonListReturnsEmptyPlan() {
        PackingResult result = packer.allocate(new Product(10, 10, 10, 1, 3), List.of());

        assertTrue(result.entries().isEmpty());
        assertEquals(3, result.remainingDemand());
    }

    @Test
    void testNullInputsThrowException() {
        Product product = new Product(10, 10, 10, 1, 1);

        assertThrows(IllegalArgumentException.class, () -> packer.allocate(null, List.of()));
        assertThrows(IllegalArgumentException.class, () -> packer.allocate(product, null));
    }

    @Test
    void testPartialPlanIsKeptWhenStockRunsOut() {
        // Both types run out; whatever was committed must still be reported
        Product product = new Product(10, 10, 10, 1, 20);
        List<CartonType> cartons = List.of(
                new CartonType(21, 21, 21, 100, 1),
                new CartonType(11, 11, 21, 100, 2)
        );

        PackingResult result = packer.allocate(product, cartons);

        assertEquals(2, result.entries().size());
        assertEquals(8, result.entries().get(0).totalItems());
        assertEquals(4, result.entries().get(1).totalItems());
        assertEquals(2, result.entries().get(1).cartonsUsed());
        assertEquals(8, result.remainingDemand());
    }

    @Test
    void testLargerCapacityWinsOverInputOrder() {
        Product product = new Product(10, 10, 10, 1, 9);
        List<CartonType> cartons = List.of(
                new CartonType(11, 11, 11, 100, 5),  // holds 1
                new CartonType(21, 21, 21, 100, 1)   // holds 8
        );

        PackingResult result = packer.allocate(product, cartons);

        assertEquals(2, result.entries().size());
        assertEquals(1, result.entries().get(0).cartonIndex(), "Bigger carton is committed first");
        assertEquals(8, result.entries().get(0).totalItems());
        assertEquals(0, result.entries().get(1).cartonIndex());
        assertEquals(1, result.entries().get(1).totalItems());
        assertEquals(0, result.remainingDemand());
    }

    @Test
    void testTiesGoToFirstCartonInInputOrder() {
        Product product = new Product(10, 10, 10, 1, 8);
        List<CartonType> cartons = List.of(
                new CartonType(21, 21, 21, 100, 1),
                new CartonType(21, 21, 21, 100, 1)
        );

        PackingResult result = packer.allocate(product, cartons);

        assertEquals(1, result.entries().size());
        assertEquals(0, result.entries().get(0).cartonIndex());
    }

    @Test
    void testCappedCapacityTiePrefersEarlierCarton() {
        // Demand of 1 caps every carton to 1 unit, so the first listed type wins
        Product product = new Product(10, 10, 10, 1, 1);
        List<CartonType> cartons = List.of(
                new CartonType(11, 11, 11, 100, 1),
                new CartonType(21, 21, 21, 100, 1)
        );

        PackingResult result = packer.allocate(product, cartons);

        assertEquals(0, result.entries().get(0).cartonIndex());
        assertEquals(1, result.entries().get(0).totalItems());
    }

    @Test
    void testBestOrientationIsChosenAndFirstOrientationWinsTies() {
        // Interior 20 x 20 x 30: orientations 1 and 4 both hold 8, the rest hold 6
        Product product = new Product(15, 10, 10, 1, 8);
        List<CartonType> cartons = List.of(new CartonType(21, 21, 31, 100, 1));

        PackingResult result = packer.allocate(product, cartons);

        assertEquals(Orientation.BHL, result.entries().get(0).orientation());
        assertEquals(8, result.entries().get(0).totalItems());
    }

    @Test
    void testOrientationRecordedFromFirstCommitOnly() {
        Product product = new Product(15, 10, 10, 1, 10);
        List<CartonType> cartons = List.of(new CartonType(21, 21, 31, 100, 2));
        AllocationObserver observer = mock(AllocationObserver.class);

        PackingResult result = new GreedyCartonPacker(observer).allocate(product, cartons);

        // Second carton only needs 2 units; every orientation ties and orientation 0 is picked
        ArgumentCaptor<FitRecord> fits = ArgumentCaptor.forClass(FitRecord.class);
        verify(observer, times(2)).onCommit(fits.capture(), anyInt(), anyInt());
        assertEquals(Orientation.BHL, fits.getAllValues().get(0).orientation());
        assertEquals(Orientation.LBH, fits.getAllValues().get(1).orientation());

        PackingPlanEntry entry = result.entries().get(0);
        assertEquals(Orientation.BHL, entry.orientation());
        assertEquals(2, entry.fitLengthwise());
        assertEquals(2, entry.fitBreadthwise());
        assertEquals(2, entry.fitHeightwise());
        assertEquals(2, entry.cartonsUsed());
        assertEquals(10, entry.totalItems());
    }

    @Test
    void testWeightLimitDrivesCartonCount() {
        Product product = new Product(10, 10, 10, 25, 10);
        List<CartonType> cartons = List.of(new CartonType(21, 21, 21, 100, 5));

        PackingResult result = packer.allocate(product, cartons);

        PackingPlanEntry entry = result.entries().get(0);
        assertEquals(3, entry.cartonsUsed(), "4 + 4 + 2 units by weight");
        assertEquals(10, entry.totalItems());
        assertEquals(0, result.remainingDemand());
    }

    @Test
    void testCallerCartonListIsNotModified() {
        Product product = new Product(10, 10, 10, 1, 16);
        List<CartonType> cartons = new ArrayList<>(List.of(new CartonType(21, 21, 21, 100, 3)));

        PackingResult first = packer.allocate(product, cartons);
        PackingResult second = packer.allocate(product, cartons);

        assertEquals(3, cartons.get(0).quantity());
        assertEquals(1, cartons.size());
        assertEquals(first, second, "Reusing the same input must give the same plan");
    }

    @Test
    void testObserverReceivesCommitsThenCompletion() {
        Product product = new Product(10, 10, 10, 1, 10);
        List<CartonType> cartons = List.of(new CartonType(21, 21, 21, 100, 1));
        AllocationObserver observer = mock(AllocationObserver.class);

        PackingResult result = new GreedyCartonPacker(observer).allocate(product, cartons);

        InOrder inOrder = inOrder(observer);
        inOrder.verify(observer).onCommit(any(FitRecord.class), eq(8), eq(2));
        inOrder.verify(observer).onInfeasible(2);
        inOrder.verify(observer).onComplete(result);
        verifyNoMoreInteractions(observer);
    }

    @Test
    void testObserverNotToldInfeasibleWhenFullyPacked() {
        AllocationObserver observer = mock(AllocationObserver.class);

        new GreedyCartonPacker(observer).allocate(new Product(10, 10, 10, 1, 8),
                List.of(new CartonType(21, 21, 21, 100, 1)));

        verify(observer, never()).onInfeasible(anyInt());
        verify(observer).onComplete(any(PackingResult.class));
    }

    @Test
    void testConstructorRejectsNullCollaborators() {
        assertThrows(IllegalArgumentException.class,
                () -> new GreedyCartonPacker(null, new AllocationObserver() {}));
        assertThrows(IllegalArgumentException.class,
                () -> new GreedyCartonPacker(new OrientationEvaluator(), null));
    }
}
