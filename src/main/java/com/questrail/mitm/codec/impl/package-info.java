/**
 * Default wire codec implementation. Field labels and payload escaping are
 * package-private; the encoder, the decoder and the terminator helpers of
 * {@link com.questrail.mitm.codec.impl.MessageFraming} are public.
 */
package com.questrail.mitm.codec.impl;
