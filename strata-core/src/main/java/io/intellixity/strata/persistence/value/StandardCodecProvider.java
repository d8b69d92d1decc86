package io.intellixity.strata.persistence.value;

import java.util.Collection;
import java.util.List;

/** Ready-made named codecs shipped with core: {@code json} and {@code csv-tags}. */
public final class StandardCodecProvider implements CodecProvider {
  @Override
  public Collection<ValueCodec<?>> codecs() {
    return List.of(new JsonCodec(), new CsvTagsCodec());
  }
}
