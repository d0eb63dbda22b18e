package com.myorg.specdiff.service.implementation;

import com.myorg.specdiff.config.DiffOptions;
import com.myorg.specdiff.exception.ContractViolationException;
import com.myorg.specdiff.model.DiffRecord;
import com.myorg.specdiff.model.DiffResult;
import com.myorg.specdiff.model.Entity;
import com.myorg.specdiff.model.Node;
import com.myorg.specdiff.model.Operation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.myorg.specdiff.Documents.NEW_JSON;
import static com.myorg.specdiff.Documents.OLD_JSON;
import static com.myorg.specdiff.Documents.enumeration;
import static com.myorg.specdiff.Documents.load;
import static com.myorg.specdiff.Documents.model;
import static com.myorg.specdiff.Documents.object;
import static com.myorg.specdiff.Documents.parameter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class StructuralTreeDifferTest {

    private static StructuralTreeDiffer differ(DiffOptions options) {
        return new StructuralTreeDiffer(options, new MyersContentDiffer());
    }

    private static DiffResult diff(Node oldRoot, Node newRoot) {
        return differ(DiffOptions.defaults()).diff(oldRoot, newRoot);
    }

    private static Node withAttributes(String kind, String... nameValues) {
        Node.NodeBuilder b = Node.builder().kind(kind).describable(true);
        for (int i = 0; i < nameValues.length; i += 2) {
            b.attribute(nameValues[i], nameValues[i + 1]);
        }
        return b.build();
    }

    @Test
    void diff_identicalCopyHasNoDifferences() {
        Node tree = load(NEW_JSON);

        DiffResult result = diff(tree, tree.copy());

        assertThat(result.getDiffMap().isEmpty()).isTrue();
        assertThat(result.isComplete()).isTrue();
    }

    @Test
    void diff_changedAttributeIsOneRecordOnTheObject() {
        Node oldObj = withAttributes("object", "name", "Foo.", "status", "current");
        Node newObj = withAttributes("object", "name", "Foo.", "status", "deprecated");

        DiffResult result = diff(model(oldObj), model(newObj));

        List<DiffRecord> records = result.getDiffMap().records();
        assertThat(records).singleElement().satisfies(r -> {
            assertThat(r.getEntity()).isEqualTo(Entity.ATTRIBUTE);
            assertThat(r.getOperation()).isEqualTo(Operation.CHANGED);
            assertThat(r.getName()).isEqualTo("status");
            assertThat(r.getValue()).isEqualTo("current");
            assertThat(r.getValue2()).isEqualTo("deprecated");
        });
        assertThat(result.getDiffMap().modelItems()).containsExactly(newObj);
    }

    @Test
    void diff_removedChildIsOwnedByTheNewParent() {
        Node oldFoo = object("a.xml", "Foo.");
        Node oldRoot = model(oldFoo, object("a.xml", "Bar."));
        Node newRoot = model(object("a.xml", "Bar."));

        DiffResult result = diff(oldRoot, newRoot);

        assertThat(result.getDiffMap().modelItems()).containsExactly(newRoot);
        assertThat(result.getDiffMap().get(newRoot)).singleElement().satisfies(r -> {
            assertThat(r.getEntity()).isEqualTo(Entity.ELEMENT);
            assertThat(r.getOperation()).isEqualTo(Operation.REMOVED);
            assertThat(r.getElem()).isSameAs(oldFoo);
            assertThat(r.getNewNode()).isSameAs(newRoot);
        });
    }

    @Test
    void diff_unclaimedNewChildIsAdded() {
        Node baz = object("a.xml", "Baz.");
        Node newRoot = model(object("a.xml", "Bar."), baz);

        DiffResult result = diff(model(object("a.xml", "Bar.")), newRoot);

        assertThat(result.getDiffMap().records())
                .extracting(DiffRecord::getEntity, DiffRecord::getOperation, DiffRecord::getElem)
                .containsExactly(tuple(Entity.ELEMENT, Operation.ADDED, baz));
    }

    @Test
    void diff_sourceFileKeyComponentIsIgnored() {
        Node oldRoot = model(object("tr-181-2-11.xml", "Device.WiFi."));
        Node newRoot = model(object("tr-181-2-12.xml", "Device.WiFi."));

        assertThat(diff(oldRoot, newRoot).getDiffMap().isEmpty()).isTrue();
    }

    @Test
    void diff_keysStillDecideWhenNothingIsSkipped() {
        Node oldRoot = model(object("tr-181-2-11.xml", "Device.WiFi."));
        Node newRoot = model(object("tr-181-2-12.xml", "Device.WiFi."));
        DiffOptions strict = DiffOptions.defaults().toBuilder().keyComponentsToSkip(0).build();

        DiffResult result = differ(strict).diff(oldRoot, newRoot);

        assertThat(result.getDiffMap().records())
                .extracting(DiffRecord::getOperation)
                .containsExactly(Operation.REMOVED, Operation.ADDED);
    }

    @Test
    void diff_unkeyedSiblingsAreMatchedByLabel() {
        Node added = enumeration("C");
        Node oldParam = parameter("Mode", null, enumeration("A"), enumeration("B"));
        Node newParam = parameter("Mode", null, enumeration("B"), enumeration("A"), added);

        DiffResult result = diff(model(oldParam), model(newParam));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.getDiffMap().records())
                .extracting(DiffRecord::getOperation, DiffRecord::getElem)
                .containsExactly(tuple(Operation.ADDED, added));
    }

    @Test
    void diff_labelTieIsUnresolvedAndSkipped() {
        Node oldParam = parameter("Mode", null, enumeration("A"));
        Node newParam = parameter("Mode", null, enumeration("A"), enumeration("A"));

        DiffResult result = diff(model(oldParam), model(newParam));

        assertThat(result.isComplete()).isFalse();
        assertThat(result.getUnresolvedCount()).isEqualTo(1);
        assertThat(result.getUnresolved().get(0)).contains("enumeration");
        // neither candidate was claimed
        assertThat(result.getDiffMap().records())
                .extracting(DiffRecord::getOperation)
                .containsExactly(Operation.ADDED, Operation.ADDED);
    }

    @Test
    void diff_customStrategyBreaksTies() {
        Node second = enumeration("A");
        Node oldParam = parameter("Mode", null, enumeration("A"));
        Node newParam = parameter("Mode", null, enumeration("A"), second);
        DiffOptions options = DiffOptions.defaults().toBuilder()
                .matchStrategies(List.of((old, candidates) -> Optional.of(candidates.get(candidates.size() - 1))))
                .build();

        DiffResult result = differ(options).diff(model(oldParam), model(newParam));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.getDiffMap().records()).singleElement()
                .satisfies(r -> assertThat(r.getElem()).isNotSameAs(second));
    }

    @Test
    void diff_ignoredKindsAndAttributesAreNotReported() {
        Node ref = Node.builder().kind("componentRef").attribute("ref", "Stats").build();
        Node oldRoot = Node.builder().kind("model").attribute("name", "Device:2").attribute("version", "2.11")
                .describable(true).child(ref).build();
        Node newRoot = Node.builder().kind("model").attribute("name", "Device:2").attribute("version", "2.12")
                .describable(true).child(Node.builder().kind("profile").attribute("name", "Baseline:1").build())
                .build();

        assertThat(diff(oldRoot, newRoot).getDiffMap().isEmpty()).isTrue();
    }

    @Test
    void diff_attributesChangedThenRemovedThenAdded() {
        Node oldNode = withAttributes("object", "a", "1", "b", "2", "c", "3");
        Node newNode = withAttributes("object", "d", "5", "c", "4", "a", "1");

        DiffResult result = diff(oldNode, newNode);

        assertThat(result.getDiffMap().records())
                .extracting(DiffRecord::getOperation, DiffRecord::getName)
                .containsExactly(
                        tuple(Operation.CHANGED, "c"),
                        tuple(Operation.REMOVED, "b"),
                        tuple(Operation.ADDED, "d"));
    }

    @Test
    void diff_differentKindsViolateTheContract() {
        assertThatThrownBy(() -> diff(withAttributes("object"), withAttributes("parameter")))
                .isInstanceOf(ContractViolationException.class)
                .hasMessageContaining("object");
    }

    @Test
    void diff_sampleDocumentsInDiscoveryOrder() {
        DiffResult result = diff(load(OLD_JSON), load(NEW_JSON));

        assertThat(result.getDiffMap().records())
                .extracting(DiffRecord::getEntity, DiffRecord::getOperation)
                .containsExactly(
                        tuple(Entity.ATTRIBUTE, Operation.CHANGED),
                        tuple(Entity.ELEMENT, Operation.REMOVED),
                        tuple(Entity.ELEMENT, Operation.ADDED),
                        tuple(Entity.CONTENT, Operation.CHANGED),
                        tuple(Entity.ELEMENT, Operation.REMOVED));
        assertThat(result.getDiffMap().modelItems())
                .extracting(Node::getLabel)
                .containsExactly("Device.WiFi.", "Enable", "Device:2");
    }
}
