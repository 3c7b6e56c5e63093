package co.fanki.ratchet.shared;

import java.io.Serializable;

/**
 * Marker interface for the immutable values that flow through the
 * extraction pipeline (namespace paths, constant names, spans).
 *
 * <p>Implementations are compared by value, validate themselves on
 * construction and never change afterwards, so they can be shared freely
 * between threads scanning different files.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
