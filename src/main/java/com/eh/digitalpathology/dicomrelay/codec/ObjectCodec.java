package com.eh.digitalpathology.dicomrelay.codec;

import com.eh.digitalpathology.dicomrelay.model.InboundObject;

public interface ObjectCodec {

    InboundObject readIdentifiers ( byte[] encoded );

    byte[] serialize ( InboundObject object );
}
