/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.mir.ir;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PlaceTest {
  private static final Type I32 = Type.scalar("i32");
  private static final Type PAIR = Type.tuple(I32, Type.scalar("bool"));
  private static final Type NESTED = Type.tuple(PAIR, Type.ref(Mutability.NOT, PAIR));

  @Test
  public void testPlaceTyThroughFieldsAndDeref() {
    Body body = newBody(NESTED);
    Local local = Local.of(1);
    ImmutableList<ProjectionElem> projection =
        ImmutableList.of(
            ProjectionElem.field(1, Type.ref(Mutability.NOT, PAIR)),
            ProjectionElem.deref(),
            ProjectionElem.field(0, I32));

    Place place = body.makePlace(local, projection);

    assertThat(body.placeTy(place).getType()).isEqualTo(I32);
    assertThat(place.isIndirect()).isTrue();
    assertThat(place.toString()).isEqualTo("(*_1.1).0");
  }

  @Test
  public void testMismatchedFieldTypeRejected() {
    Body body = newBody(PAIR);
    Place place = body.makePlace(Local.of(1), ImmutableList.of(ProjectionElem.field(1, I32)));

    assertThrows(IllegalArgumentException.class, () -> body.placeTy(place));
  }

  @Test
  public void testFieldOfScalarRejected() {
    Body body = newBody(I32);
    Place place = body.makePlace(Local.of(1), ImmutableList.of(ProjectionElem.field(0, I32)));

    assertThrows(IllegalArgumentException.class, () -> body.placeTy(place));
  }

  @Test
  public void testDowncastSelectsVariant() {
    AdtDef opt =
        AdtDef.enumeration(
            "Opt",
            ImmutableList.of(
                AdtDef.VariantDef.create("None", ImmutableList.of()),
                AdtDef.VariantDef.create(
                    "Some", ImmutableList.of(AdtDef.FieldDef.create("0", PAIR)))));
    Body body = newBody(Type.adt(opt));
    Place place =
        body.makePlace(
            Local.of(1),
            ImmutableList.of(ProjectionElem.downcast(1, "Some"), ProjectionElem.field(0, PAIR)));

    assertThat(body.placeTy(place).getType()).isEqualTo(PAIR);
    assertThat(place.toString()).isEqualTo("(_1 as Some).0");
  }

  @Test
  public void testProjectionsInterned() {
    Body body = newBody(NESTED);
    Place first = body.makePlace(Local.of(1), ImmutableList.of(ProjectionElem.field(0, PAIR)));
    Place second = body.makePlace(Local.of(0), ImmutableList.of(ProjectionElem.field(0, PAIR)));

    assertThat(first.getProjection()).isSameInstanceAs(second.getProjection());
  }

  @Test
  public void testProjectDeeper() {
    Body body = newBody(NESTED);
    Place base = body.makePlace(Local.of(1), ImmutableList.of(ProjectionElem.field(0, PAIR)));

    Place deeper =
        base.projectDeeper(ImmutableList.of(ProjectionElem.field(1, Type.scalar("bool"))),
            body.getInterner());

    assertThat(deeper.toString()).isEqualTo("_1.0.1");
    assertThat(base.projectDeeper(ImmutableList.of(), body.getInterner())).isSameInstanceAs(base);
  }

  @Test
  public void testPlaceRefPrefixes() {
    PlaceRef place =
        PlaceRef.of(
            Local.of(1),
            ImmutableList.of(ProjectionElem.field(0, PAIR), ProjectionElem.field(1, I32)));

    assertThat(place.startsWithField()).isTrue();
    assertThat(place.prefix(1).toString()).isEqualTo("_1.0");
    assertThat(place.extendsProjection(place.prefix(1).getProjection())).isTrue();
    assertThat(place.prefix(1).extendsProjection(place.getProjection())).isFalse();
    assertThat(PlaceRef.of(Local.of(1)).startsWithField()).isFalse();
    assertThat(PlaceRef.of(Local.of(1)).asLocal()).isEqualTo(Local.of(1));
  }

  @Test
  public void testConstantIndexFormatting() {
    assertThat(ProjectionElem.constantIndex(2, 4, false).toString()).isEqualTo("[2 of 4]");
    assertThat(ProjectionElem.constantIndex(1, 4, true).toString()).isEqualTo("[-1 of 4]");
    assertThat(ProjectionElem.index(Local.of(3)).toString()).isEqualTo("[_3]");
  }

  private static Body newBody(Type localType) {
    Body body = new Body("f", 0, ImmutableList.of());
    body.pushLocal(LocalDecl.create(Mutability.MUT, NESTED));
    body.pushLocal(LocalDecl.create(Mutability.MUT, localType));
    return body;
  }
}
