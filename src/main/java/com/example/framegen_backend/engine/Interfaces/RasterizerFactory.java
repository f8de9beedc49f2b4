package com.example.framegen_backend.engine.Interfaces;

import com.example.framegen_backend.dto.FrameSize;

public interface RasterizerFactory {
    FrameRasterizer open(FrameSize size);
}
